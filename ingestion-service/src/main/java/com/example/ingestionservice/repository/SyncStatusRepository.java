package com.example.ingestionservice.repository;

import com.example.ingestionservice.entity.SyncStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface SyncStatusRepository extends JpaRepository<SyncStatus, String>, SyncStatusRepositoryCustom {
}
