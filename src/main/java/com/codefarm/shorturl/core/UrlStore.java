package com.codefarm.shorturl.core;

import com.codefarm.shorturl.exception.DuplicateShortCodeException;
import com.codefarm.shorturl.model.UrlRecord;
import com.codefarm.shorturl.repository.UrlRecordRepository;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.sql.SQLException;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

@Component
public class UrlStore {

    private static final String UNIQUE_VIOLATION = "23505";

    private final UrlRecordRepository repository;

    public UrlStore(UrlRecordRepository repository) {
        this.repository = repository;
    }

    @Transactional(readOnly = true)
    public boolean exists(String shortCode) {
        return repository.existsByShortCode(shortCode);
    }

    /**
     * Inserts a new record and flushes so the unique constraint is checked before returning.
     *
     * @throws DuplicateShortCodeException if the code is already stored
     */
    @Transactional
    public UrlRecord insert(String shortCode, String longUrl) {
        try {
            return repository.saveAndFlush(new UrlRecord(shortCode, longUrl, LocalDateTime.now()));
        } catch (DataIntegrityViolationException ex) {
            if (isUniqueViolation(ex)) {
                throw new DuplicateShortCodeException(shortCode, ex);
            }
            throw ex;
        }
    }

    @Transactional(readOnly = true)
    public Optional<String> lookup(String shortCode) {
        return repository.findByShortCode(shortCode).map(UrlRecord::getLongUrl);
    }

    @Transactional(readOnly = true)
    public long count() {
        return repository.count();
    }

    @Transactional(readOnly = true)
    public List<UrlRecord> recent(int limit) {
        return repository.findAllByOrderByCreatedAtDescIdDesc(PageRequest.of(0, limit));
    }

    private static boolean isUniqueViolation(DataIntegrityViolationException ex) {
        if (ex instanceof DuplicateKeyException) {
            return true;
        }
        return ex.getMostSpecificCause() instanceof SQLException sqlEx
                && UNIQUE_VIOLATION.equals(sqlEx.getSQLState());
    }
}
