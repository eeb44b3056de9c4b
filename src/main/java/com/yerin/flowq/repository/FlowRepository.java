package com.yerin.flowq.repository;

import com.yerin.flowq.domain.Flow;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Optional;

public interface FlowRepository extends JpaRepository<Flow, String> {
    Optional<Flow> findByPublishedVersionId(String publishedVersionId);
}
