package com.txradar.domain;

import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.Optional;

public interface PipelineRunRepository extends MongoRepository<PipelineRun, String> {

    Optional<PipelineRun> findFirstByStatusOrderByStartedAtDesc(PipelineRun.Status status);
}
