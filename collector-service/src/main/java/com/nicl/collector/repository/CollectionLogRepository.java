package com.nicl.collector.repository;

import com.nicl.collector.entity.CollectionLog;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface CollectionLogRepository extends JpaRepository<CollectionLog, Long> {

    List<CollectionLog> findTop5ByOrderByCreatedAtDescIdDesc();
}
