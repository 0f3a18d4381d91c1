package com.repotide.repository;

import com.repotide.model.StoredEvent;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

/**
 * Database access for stored webhook events.
 *
 * findAllByOrderByIdDesc(PageRequest.of(0, 10))
 * → SELECT * FROM github_events ORDER BY id DESC LIMIT 10
 */
public interface GitHubEventRepository extends JpaRepository<StoredEvent, Long> {

    List<StoredEvent> findAllByOrderByIdDesc(Pageable pageable);
}
