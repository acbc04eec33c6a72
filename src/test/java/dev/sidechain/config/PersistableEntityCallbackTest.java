package dev.sidechain.config;

import dev.sidechain.entity.NotificationPreference;
import dev.sidechain.entity.User;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.data.relational.core.sql.SqlIdentifier;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import static org.assertj.core.api.Assertions.assertThat;

class PersistableEntityCallbackTest {

    private final PersistableEntityCallback callback = new PersistableEntityCallback();

    @Test
    @DisplayName("Should mark loaded rows as existing so save() updates them")
    void shouldClearNewFlagOnLoadedEntities() {
        // Given
        User user = User.builder().id("u-1").build();
        assertThat(user.isNew()).isTrue();

        // When
        StepVerifier.create(Mono.from(callback.onAfterConvert(user, SqlIdentifier.unquoted("users"))))
                .expectNext(user)
                .verifyComplete();

        // Then
        assertThat(user.isNew()).isFalse();
    }

    @Test
    @DisplayName("Should handle preference rows the same way")
    void shouldClearNewFlagOnPreferences() {
        NotificationPreference preference = NotificationPreference.defaultsFor("u-1");

        StepVerifier.create(Mono.from(callback.onAfterConvert(preference, SqlIdentifier.unquoted("notification_preferences"))))
                .expectNextCount(1)
                .verifyComplete();

        assertThat(preference.isNew()).isFalse();
    }

    @Test
    @DisplayName("Should pass through objects that do not track newness")
    void shouldPassThroughOtherObjects() {
        Object plain = "row";

        StepVerifier.create(Mono.from(callback.onAfterConvert(plain, SqlIdentifier.unquoted("t"))))
                .expectNext("row")
                .verifyComplete();
    }
}
