package com.codefarm.shorturl.repository;

import com.codefarm.shorturl.model.UrlRecord;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.Optional;

public interface UrlRecordRepository extends JpaRepository<UrlRecord, Long> {
    boolean existsByShortCode(String shortCode);
    Optional<UrlRecord> findByShortCode(String shortCode);
    List<UrlRecord> findAllByOrderByCreatedAtDescIdDesc(Pageable pageable);
}
