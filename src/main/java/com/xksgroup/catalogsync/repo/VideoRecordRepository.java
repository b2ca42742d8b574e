package com.xksgroup.catalogsync.repo;

import com.xksgroup.catalogsync.model.VideoRecord;
import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;

@Repository
public interface VideoRecordRepository extends MongoRepository<VideoRecord, String> {

    boolean existsByExternalId(String externalId);

    List<VideoRecord> findByExternalIdIn(Collection<String> externalIds);
}
