package com.ospicorp.netload.load.repository;

import com.ospicorp.netload.load.model.PredictionJob;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface PredictionJobRepository extends JpaRepository<PredictionJob, Long> {
}
