package com.trialwatch.repository;

import com.trialwatch.model.CitationEntity;
import com.trialwatch.model.CitationId;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface CitationRepository extends JpaRepository<CitationEntity, CitationId> {

    List<CitationEntity> findByNctIdOrderByPubDateDesc(String nctId);
}
