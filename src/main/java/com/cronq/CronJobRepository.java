package com.cronq;

import jakarta.persistence.QueryHint;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.jpa.repository.QueryHints;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.OffsetDateTime;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface CronJobRepository extends JpaRepository<CronJob, UUID> {

    /**
     * Number of jobs per lifecycle status.
     */
    interface StatusCount {
        CronJobStatus getStatus();

        Long getCount();
    }

    /**
     * Active jobs, other than {@code excludedStatuses}, whose next execution falls within {@code [from, to]}.
     */
    @Query("""
            SELECT j FROM CronJob j
            WHERE j.active = true
              AND j.status NOT IN :excludedStatuses
              AND j.nextExecutionTime >= :from
              AND j.nextExecutionTime <= :to
            ORDER BY j.nextExecutionTime ASC
            """)
    @QueryHints(@QueryHint(name = "org.hibernate.readOnly", value = "true"))
    List<CronJob> findActiveDueBetweenExcludingStatuses(
            @Param("excludedStatuses") Collection<CronJobStatus> excludedStatuses,
            @Param("from") OffsetDateTime from,
            @Param("to") OffsetDateTime to,
            Pageable pageable);

    /**
     * Jobs due within {@code [from, to]} that are neither claimed nor executing.
     */
    default List<CronJob> findDueForAssignment(OffsetDateTime from, OffsetDateTime to, Pageable pageable) {
        return findActiveDueBetweenExcludingStatuses(List.of(CronJobStatus.ASSIGNED, CronJobStatus.RUNNING), from,
                to, pageable);
    }

    /**
     * Active jobs in {@code status} whose next execution lies before {@code threshold}.
     */
    @Query("""
            SELECT j FROM CronJob j
            WHERE j.active = true
              AND j.status = :status
              AND j.nextExecutionTime < :threshold
            ORDER BY j.nextExecutionTime ASC
            """)
    @QueryHints(@QueryHint(name = "org.hibernate.readOnly", value = "true"))
    List<CronJob> findActiveOverdue(
            @Param("status") CronJobStatus status,
            @Param("threshold") OffsetDateTime threshold,
            Pageable pageable);

    @Query("SELECT j.id FROM CronJob j WHERE j.id IN :ids AND j.active = true")
    List<UUID> findActiveIds(@Param("ids") Collection<UUID> ids);

    Optional<CronJob> findFirstByOrganizationIdAndActiveTrueAndNextExecutionTimeAfterOrderByNextExecutionTimeAsc(
            String organizationId, OffsetDateTime after);

    @Query("SELECT j.status AS status, COUNT(j) AS count FROM CronJob j GROUP BY j.status")
    List<StatusCount> countByStatus();

    @Modifying
    @Transactional
    int deleteByActiveFalseAndUpdatedAtBefore(OffsetDateTime updatedAt);

    @Modifying
    @Query("""
            UPDATE CronJob j
            SET j.status = :status,
                j.nextExecutionTime = :nextExecutionTime,
                j.clusterId = :clusterId,
                j.serverId = :serverId,
                j.workerId = :workerId,
                j.updatedAt = :now,
                j.version = j.version + 1
            WHERE j.id = :id
              AND j.active = true
              AND j.status <> :running
              AND j.version = :expectedVersion
            """)
    int updateAssignment(
            @Param("id") UUID id,
            @Param("expectedVersion") Long expectedVersion,
            @Param("running") CronJobStatus running,
            @Param("status") CronJobStatus status,
            @Param("nextExecutionTime") OffsetDateTime nextExecutionTime,
            @Param("clusterId") String clusterId,
            @Param("serverId") String serverId,
            @Param("workerId") String workerId,
            @Param("now") OffsetDateTime now);

    /**
     * Claims a job for this worker: {@code assigned}, stamped with the identity.
     * Succeeds only while the job is active, not running and unchanged since it was read.
     *
     * @return the number of updated rows, 0 when another path won
     */
    default int claim(UUID id, Long expectedVersion, OffsetDateTime nextExecutionTime, WorkerIdentity identity,
            OffsetDateTime now) {
        return updateAssignment(id, expectedVersion, CronJobStatus.RUNNING, CronJobStatus.ASSIGNED, nextExecutionTime,
                identity.clusterId(), identity.serverId(), identity.workerId(), now);
    }

    /**
     * Leaves a job {@code pending} for a later sweep with a new next execution time.
     */
    default int defer(UUID id, Long expectedVersion, OffsetDateTime nextExecutionTime, OffsetDateTime now) {
        return updateAssignment(id, expectedVersion, CronJobStatus.RUNNING, CronJobStatus.PENDING, nextExecutionTime,
                null, null, null, now);
    }

    @Modifying
    @Query("""
            UPDATE CronJob j
            SET j.status = :running,
                j.updatedAt = :now,
                j.version = j.version + 1
            WHERE j.id = :id
              AND j.active = true
              AND j.status = :assigned
              AND j.version = :expectedVersion
            """)
    int updateRunning(
            @Param("id") UUID id,
            @Param("expectedVersion") Long expectedVersion,
            @Param("assigned") CronJobStatus assigned,
            @Param("running") CronJobStatus running,
            @Param("now") OffsetDateTime now);

    default int markRunning(UUID id, Long expectedVersion, OffsetDateTime now) {
        return updateRunning(id, expectedVersion, CronJobStatus.ASSIGNED, CronJobStatus.RUNNING, now);
    }
}
