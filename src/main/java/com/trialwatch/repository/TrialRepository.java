package com.trialwatch.repository;

import com.trialwatch.model.TrialEntity;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

@Repository
public interface TrialRepository extends JpaRepository<TrialEntity, String> {

    @Query("SELECT t.pubmedCount FROM TrialEntity t WHERE t.nctId = :nctId")
    Optional<Integer> findPubmedCountByNctId(@Param("nctId") String nctId);

    /**
     * Trials whose primary completion lies in [0, readoutDays] days ahead or
     * [recentlyCompletedFrom, -1] days behind.
     */
    @Query("SELECT t FROM TrialEntity t WHERE t.daysToPrimaryCompletion IS NOT NULL"
            + " AND ((t.daysToPrimaryCompletion BETWEEN 0 AND :readoutDays)"
            + " OR (t.daysToPrimaryCompletion BETWEEN :recentlyCompletedFrom AND -1))"
            + " ORDER BY t.totalScore DESC, t.primaryCompletionDateParsed ASC")
    List<TrialEntity> findActionable(
            @Param("readoutDays") int readoutDays,
            @Param("recentlyCompletedFrom") int recentlyCompletedFrom);

    @Query("SELECT t.nctId FROM TrialEntity t WHERE t.daysToPrimaryCompletion IS NOT NULL"
            + " AND ((t.daysToPrimaryCompletion BETWEEN 0 AND :readoutDays)"
            + " OR (t.daysToPrimaryCompletion BETWEEN :recentlyCompletedFrom AND -1))"
            + " ORDER BY t.totalScore DESC")
    List<String> findActionableIds(
            @Param("readoutDays") int readoutDays,
            @Param("recentlyCompletedFrom") int recentlyCompletedFrom,
            Pageable page);

    @Query("SELECT t.nctId FROM TrialEntity t ORDER BY t.totalScore DESC")
    List<String> findTopIds(Pageable page);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE TrialEntity t SET t.pubmedCount = :count, t.pubmedLatestDate = :latestDate,"
            + " t.lastPubmedCheckUtc = :checkedAt WHERE t.nctId = :nctId")
    int updateLiteratureSummary(
            @Param("nctId") String nctId,
            @Param("count") int count,
            @Param("latestDate") String latestDate,
            @Param("checkedAt") Instant checkedAt);
}
