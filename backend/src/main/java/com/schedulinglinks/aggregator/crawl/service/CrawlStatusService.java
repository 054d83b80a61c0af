package com.schedulinglinks.aggregator.crawl.service;

import com.schedulinglinks.aggregator.crawl.model.StatusResponse;
import com.schedulinglinks.aggregator.crawl.persistence.CrawlJdbcRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;

@Service
public class CrawlStatusService {
    private static final Logger log = LoggerFactory.getLogger(CrawlStatusService.class);

    private final CrawlJdbcRepository repository;
    private final Clock clock;

    public CrawlStatusService(CrawlJdbcRepository repository, Clock clock) {
        this.repository = repository;
        this.clock = clock;
    }

    public StatusResponse getStatus() {
        boolean dbConnected;
        try {
            dbConnected = repository.isDbReachable();
        } catch (DataAccessException e) {
            log.warn("Database not reachable: {}", e.getMessage());
            dbConnected = false;
        }
        if (!dbConnected) {
            return new StatusResponse(clock.instant(), false, new LinkedHashMap<>());
        }
        Map<String, Long> counts = repository.tableCounts();
        return new StatusResponse(clock.instant(), true, counts);
    }
}
