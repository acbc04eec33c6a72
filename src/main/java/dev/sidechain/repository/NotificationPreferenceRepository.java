package dev.sidechain.repository;

import dev.sidechain.entity.NotificationPreference;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface NotificationPreferenceRepository extends ReactiveCrudRepository<NotificationPreference, String> {
}
