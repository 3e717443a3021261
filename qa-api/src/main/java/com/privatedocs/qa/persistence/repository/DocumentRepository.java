package com.privatedocs.qa.persistence.repository;

import com.privatedocs.qa.model.DocumentStatus;
import com.privatedocs.qa.persistence.entity.DocumentEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

public interface DocumentRepository extends JpaRepository<DocumentEntity, String> {

    Optional<DocumentEntity> findTopByOwnerIdAndContentHashOrderByVersionDesc(String ownerId, String contentHash);

    List<DocumentEntity> findByOwnerId(String ownerId);

    List<DocumentEntity> findDistinctByStatusAndAccessTagsIn(DocumentStatus status, Collection<String> tags);

    long countByStatus(DocumentStatus status);

    @Query("select d.id from DocumentEntity d where d.status = :status")
    List<String> findIdsByStatus(@Param("status") DocumentStatus status);

    @Query("select d.id from DocumentEntity d where d.status = :status and d.ownerId = :ownerId")
    List<String> findIdsByStatusAndOwnerId(@Param("status") DocumentStatus status, @Param("ownerId") String ownerId);

    @Query("select distinct d.id from DocumentEntity d join d.accessTags t where d.status = :status and t in :tags")
    List<String> findIdsByStatusAndAnyTag(@Param("status") DocumentStatus status, @Param("tags") Collection<String> tags);
}
