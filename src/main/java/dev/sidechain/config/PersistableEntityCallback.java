package dev.sidechain.config;

import dev.sidechain.entity.NewRecordAware;
import org.reactivestreams.Publisher;
import org.springframework.data.r2dbc.mapping.event.AfterConvertCallback;
import org.springframework.data.relational.core.sql.SqlIdentifier;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

/**
 * Marks entities loaded from the database as existing so that {@code save()}
 * issues an UPDATE for rows whose ids were assigned upstream.
 */
@Component
public class PersistableEntityCallback implements AfterConvertCallback<Object> {

    @Override
    public Publisher<Object> onAfterConvert(Object entity, SqlIdentifier table) {
        if (entity instanceof NewRecordAware aware) {
            aware.setNewRecord(false);
        }
        return Mono.just(entity);
    }
}
