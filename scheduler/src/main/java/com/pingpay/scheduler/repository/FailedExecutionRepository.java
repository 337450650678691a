package com.pingpay.scheduler.repository;

import com.pingpay.scheduler.queue.FailedExecution;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.UUID;

public interface FailedExecutionRepository extends JpaRepository<FailedExecution, UUID> {

    List<FailedExecution> findAllByOrderByFailedAtDesc();
}
