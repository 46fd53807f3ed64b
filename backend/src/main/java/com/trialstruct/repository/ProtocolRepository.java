package com.trialstruct.repository;

import com.trialstruct.model.criteria.Protocol;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface ProtocolRepository extends JpaRepository<Protocol, String> {
}
