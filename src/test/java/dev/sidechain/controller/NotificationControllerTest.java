package dev.sidechain.controller;

import dev.sidechain.dto.NotificationGroup;
import dev.sidechain.dto.PageResponse;
import dev.sidechain.security.AuthenticatedUser;
import dev.sidechain.service.NotificationFeedService;
import dev.sidechain.service.NotificationPreferenceService;
import dev.sidechain.service.feed.NotificationCounts;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class NotificationControllerTest {

    private static final AuthenticatedUser USER = new AuthenticatedUser("user-1", "alice", "USER");

    @Mock
    private NotificationFeedService feedService;

    @Mock
    private NotificationPreferenceService preferenceService;

    @InjectMocks
    private NotificationController controller;

    @Nested
    @DisplayName("GET /api/v1/notifications")
    class GetNotifications {

        @Test
        @DisplayName("Should return the caller's page of groups")
        void shouldReturnPage() {
            PageResponse<NotificationGroup> page = PageResponse.slice(List.of(), 1, 20);
            when(feedService.getNotifications("user-1", 1, 20)).thenReturn(Mono.just(page));

            StepVerifier.create(controller.getNotifications(USER, 1, 20))
                    .assertNext(response -> {
                        assertThat(response.getPage()).isEqualTo(1);
                        assertThat(response.getContent()).isEmpty();
                    })
                    .verifyComplete();
        }
    }

    @Nested
    @DisplayName("Counts")
    class Counts {

        @Test
        @DisplayName("Should return badge counts")
        void shouldReturnCounts() {
            when(feedService.getCounts("user-1")).thenReturn(Mono.just(new NotificationCounts(4, 2)));

            StepVerifier.create(controller.getCounts(USER))
                    .assertNext(counts -> {
                        assertThat(counts.unread()).isEqualTo(4);
                        assertThat(counts.unseen()).isEqualTo(2);
                    })
                    .verifyComplete();
        }

        @Test
        @DisplayName("Should mark everything read and return the new counts")
        void shouldMarkRead() {
            when(feedService.markAllRead("user-1")).thenReturn(Mono.just(NotificationCounts.ZERO));

            StepVerifier.create(controller.markRead(USER))
                    .expectNext(NotificationCounts.ZERO)
                    .verifyComplete();

            verify(feedService).markAllRead("user-1");
            verify(feedService, never()).markAllSeen(anyString());
        }

        @Test
        @DisplayName("Should mark everything seen and keep unread")
        void shouldMarkSeen() {
            when(feedService.markAllSeen("user-1")).thenReturn(Mono.just(new NotificationCounts(3, 0)));

            StepVerifier.create(controller.markSeen(USER))
                    .assertNext(counts -> assertThat(counts.unread()).isEqualTo(3))
                    .verifyComplete();
        }
    }

    @Nested
    @DisplayName("Preferences")
    class Preferences {

        @Test
        @DisplayName("Should return all categories")
        void shouldGetPreferences() {
            when(preferenceService.getPreferences("user-1"))
                    .thenReturn(Mono.just(Map.of("likes", true, "follows", false)));

            StepVerifier.create(controller.getPreferences(USER))
                    .assertNext(prefs -> assertThat(prefs).containsEntry("follows", false).hasSize(2))
                    .verifyComplete();
        }

        @Test
        @DisplayName("Should pass partial updates through")
        void shouldUpdatePreferences() {
            Map<String, Boolean> updates = Map.of("comments", false);
            when(preferenceService.setPreferences("user-1", updates))
                    .thenReturn(Mono.just(Map.of("comments", false, "likes", true)));

            StepVerifier.create(controller.updatePreferences(USER, updates))
                    .assertNext(prefs -> assertThat(prefs).containsEntry("comments", false))
                    .verifyComplete();
        }

        @Test
        @DisplayName("Should propagate a rejected category")
        void shouldPropagateRejection() {
            Map<String, Boolean> updates = Map.of("spam", true);
            when(preferenceService.setPreferences("user-1", updates))
                    .thenReturn(Mono.error(new IllegalArgumentException("Unknown notification category: spam")));

            StepVerifier.create(controller.updatePreferences(USER, updates))
                    .expectError(IllegalArgumentException.class)
                    .verify();
        }
    }
}
