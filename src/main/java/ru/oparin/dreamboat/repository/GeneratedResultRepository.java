package ru.oparin.dreamboat.repository;

import org.springframework.data.r2dbc.repository.Modifying;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import ru.oparin.dreamboat.model.entity.GeneratedResult;

@Repository
public interface GeneratedResultRepository extends ReactiveCrudRepository<GeneratedResult, Long> {

    Flux<GeneratedResult> findByUserId(Long userId);

    Flux<GeneratedResult> findByGenerationJobId(Long generationJobId);

    Mono<GeneratedResult> findByIdAndUserId(Long id, Long userId);

    Mono<Long> countByGenerationJobId(Long generationJobId);

    @Query("SELECT * FROM dreamboat.generated_result WHERE user_id = :userId AND profile_order IS NOT NULL " +
            "ORDER BY profile_order")
    Flux<GeneratedResult> findSelected(Long userId);

    @Query("SELECT COUNT(*) FROM dreamboat.generated_result WHERE user_id = :userId AND profile_order IS NOT NULL")
    Mono<Long> countSelected(Long userId);

    @Query("SELECT COUNT(*) FROM dreamboat.generated_result WHERE user_id = :userId AND is_sample = TRUE")
    Mono<Long> countSamples(Long userId);

    @Modifying
    @Query("UPDATE dreamboat.generated_result SET profile_order = NULL WHERE user_id = :userId " +
            "AND profile_order IS NOT NULL")
    Mono<Integer> clearProfileOrders(Long userId);

    @Modifying
    @Query("UPDATE dreamboat.generated_result SET profile_order = NULL WHERE user_id = :userId " +
            "AND profile_order = :profileOrder")
    Mono<Integer> clearProfileSlot(Long userId, Integer profileOrder);

    @Modifying
    @Query("UPDATE dreamboat.generated_result SET profile_order = NULL WHERE id = :id AND user_id = :userId")
    Mono<Integer> clearProfileOrder(Long id, Long userId);

    @Modifying
    @Query("UPDATE dreamboat.generated_result SET profile_order = :profileOrder WHERE id = :id AND user_id = :userId")
    Mono<Integer> assignProfileOrder(Long id, Long userId, Integer profileOrder);
}
