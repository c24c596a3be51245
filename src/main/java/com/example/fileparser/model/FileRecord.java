package com.example.fileparser.model;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.ToString;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

@Getter
@Setter
@ToString(exclude = "parsedContent")
@NoArgsConstructor
@Document(collection = "files")
public class FileRecord {

    public static final String ID = "_id";
    public static final String STATUS = "status";
    public static final String PROGRESS = "progress";
    public static final String SIZE = "size";
    public static final String PARSE_META = "parseMeta";
    public static final String PARSED_CONTENT = "parsedContent";
    public static final String CREATED_AT = "createdAt";
    public static final String UPDATED_AT = "updatedAt";

    @Id
    private String id;
    private String filename;
    private String mimetype;
    private String path;
    private Long size;
    private FileRecordStatus status;
    private int progress;
    private ParseMeta parseMeta;
    private List<Map<String, Object>> parsedContent = new ArrayList<>();
    private Instant createdAt;
    private Instant updatedAt;

    public static FileRecord uploading(String filename, String mimetype, String path) {
        Instant now = Instant.now();
        FileRecord record = new FileRecord();
        record.setFilename(filename);
        record.setMimetype(mimetype);
        record.setPath(path);
        record.setStatus(FileRecordStatus.UPLOADING);
        record.setProgress(1);
        record.setCreatedAt(now);
        record.setUpdatedAt(now);
        return record;
    }
}
