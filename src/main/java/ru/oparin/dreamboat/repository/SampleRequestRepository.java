package ru.oparin.dreamboat.repository;

import org.springframework.data.r2dbc.repository.Modifying;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Mono;
import ru.oparin.dreamboat.model.entity.SampleRequest;

import java.time.LocalDateTime;

@Repository
public interface SampleRequestRepository extends ReactiveCrudRepository<SampleRequest, Long> {

    /**
     * Зарегистрировать запрос пробной генерации.
     * Повторная регистрация для того же пользователя нарушает первичный ключ.
     */
    @Modifying
    @Query("INSERT INTO dreamboat.sample_request (user_id, source_photo_id, requested_at) " +
            "VALUES (:userId, :sourcePhotoId, :requestedAt)")
    Mono<Integer> register(Long userId, Long sourcePhotoId, LocalDateTime requestedAt);
}
