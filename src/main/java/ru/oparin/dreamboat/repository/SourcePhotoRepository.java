package ru.oparin.dreamboat.repository;

import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import ru.oparin.dreamboat.model.entity.SourcePhoto;

@Repository
public interface SourcePhotoRepository extends ReactiveCrudRepository<SourcePhoto, Long> {

    Mono<SourcePhoto> findByIdAndUserId(Long id, Long userId);

    Mono<SourcePhoto> findByUserIdAndStorageLocator(Long userId, String storageLocator);

    @Query("SELECT * FROM dreamboat.source_photo WHERE user_id = :userId ORDER BY created_at DESC")
    Flux<SourcePhoto> findByUserIdOrderByCreatedAtDesc(Long userId);
}
