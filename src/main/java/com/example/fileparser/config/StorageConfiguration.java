package com.example.fileparser.config;

import com.example.fileparser.store.BlobStorage;
import com.example.fileparser.store.FileRecordStore;
import com.example.fileparser.store.LocalBlobStorage;
import com.example.fileparser.store.MongoFileRecordStore;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.mongodb.core.MongoTemplate;

@Configuration
public class StorageConfiguration {

    @Bean
    BlobStorage blobStorage(FileParserProperties properties) {
        return new LocalBlobStorage(properties.getUploadDir());
    }

    @Bean
    FileRecordStore fileRecordStore(MongoTemplate mongoTemplate) {
        return new MongoFileRecordStore(mongoTemplate);
    }
}
