package com.flagship.wallet_ledger.audit;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.util.Optional;

@Repository
public interface TrialBalanceSnapshotRepository extends JpaRepository<TrialBalanceSnapshotEntity, LocalDate> {

    Optional<TrialBalanceSnapshotEntity> findTopByOrderByAsOfDateDesc();
}
