package com.example.ConfluenceAgent.repository;

import com.example.ConfluenceAgent.model.InvocationLog;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface InvocationLogRepository extends JpaRepository<InvocationLog, Long> {

    List<InvocationLog> findBySessionIdOrderByCreatedAtDesc(String sessionId);
}
