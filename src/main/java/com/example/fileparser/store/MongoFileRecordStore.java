package com.example.fileparser.store;

import com.example.fileparser.model.FileRecord;
import com.example.fileparser.model.FileRecordStatus;
import com.example.fileparser.model.ParseMeta;
import com.mongodb.client.result.UpdateResult;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.bson.types.ObjectId;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;

@RequiredArgsConstructor
public class MongoFileRecordStore implements FileRecordStore {

    private final MongoTemplate mongoTemplate;

    @Override
    public FileRecord create(FileRecord record) {
        return mongoTemplate.insert(record);
    }

    @Override
    public Optional<FileRecord> findById(String id) {
        if (!ObjectId.isValid(id)) {
            return Optional.empty();
        }
        return Optional.ofNullable(mongoTemplate.findById(id, FileRecord.class));
    }

    @Override
    public void raiseProgress(String id, int progress) {
        Query query = byId(id).addCriteria(Criteria.where(FileRecord.STATUS)
                .in(FileRecordStatus.UPLOADING, FileRecordStatus.PROCESSING));
        Update update = new Update()
                .max(FileRecord.PROGRESS, progress)
                .set(FileRecord.UPDATED_AT, Instant.now());
        mongoTemplate.updateFirst(query, update, FileRecord.class);
    }

    @Override
    public void recordSize(String id, long size) {
        Update update = new Update()
                .set(FileRecord.SIZE, size)
                .set(FileRecord.UPDATED_AT, Instant.now());
        mongoTemplate.updateFirst(byId(id), update, FileRecord.class);
    }

    @Override
    public boolean markProcessing(String id, FileRecordStatus expected, int progressFloor) {
        Query query = byId(id).addCriteria(Criteria.where(FileRecord.STATUS).is(expected));
        Update update = new Update()
                .set(FileRecord.STATUS, FileRecordStatus.PROCESSING)
                .max(FileRecord.PROGRESS, progressFloor)
                .set(FileRecord.UPDATED_AT, Instant.now());
        UpdateResult result = mongoTemplate.updateFirst(query, update, FileRecord.class);
        return result.getMatchedCount() > 0;
    }

    @Override
    public void markReady(String id, List<Map<String, Object>> content, ParseMeta parseMeta) {
        Update update = new Update()
                .set(FileRecord.PARSED_CONTENT, content)
                .set(FileRecord.PARSE_META, parseMeta)
                .set(FileRecord.STATUS, FileRecordStatus.READY)
                .set(FileRecord.PROGRESS, 100)
                .set(FileRecord.UPDATED_AT, Instant.now());
        mongoTemplate.updateFirst(byId(id), update, FileRecord.class);
    }

    @Override
    public void markFailed(String id) {
        Update update = new Update()
                .set(FileRecord.STATUS, FileRecordStatus.FAILED)
                .set(FileRecord.PROGRESS, 0)
                .set(FileRecord.UPDATED_AT, Instant.now());
        mongoTemplate.updateFirst(byId(id), update, FileRecord.class);
    }

    @Override
    public List<FileRecord> findAllSummaries() {
        Query query = new Query().with(Sort.by(Sort.Direction.DESC, FileRecord.CREATED_AT));
        query.fields().exclude(FileRecord.PARSED_CONTENT);
        return mongoTemplate.find(query, FileRecord.class);
    }

    @Override
    public boolean deleteById(String id) {
        if (!ObjectId.isValid(id)) {
            return false;
        }
        return mongoTemplate.remove(byId(id), FileRecord.class).getDeletedCount() > 0;
    }

    private static Query byId(String id) {
        return Query.query(Criteria.where(FileRecord.ID).is(new ObjectId(id)));
    }
}
