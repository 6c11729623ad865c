package com.ryuqq.mirror.core;

import com.ryuqq.mirror.core.model.Oplog;
import org.bson.BsonDocument;
import org.bson.BsonValue;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * {@code oplog_entries.json} 테스트 데이터 로더.
 *
 * <p>케이스 이름별로 oplog entry 배열이 들어 있습니다.</p>
 */
public final class OplogEntriesFixture {

    private static final String RESOURCE = "/oplog_entries.json";
    private static final BsonDocument DATA = load();

    private OplogEntriesFixture() {
    }

    private static BsonDocument load() {
        try (InputStream in = OplogEntriesFixture.class.getResourceAsStream(RESOURCE)) {
            if (in == null) {
                throw new IllegalStateException("missing test resource " + RESOURCE);
            }
            return BsonDocument.parse(new String(in.readAllBytes(), StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    public static List<BsonDocument> raw(String name) {
        if (!DATA.containsKey(name)) {
            throw new IllegalArgumentException("unknown fixture case: " + name);
        }
        List<BsonDocument> documents = new ArrayList<>();
        for (BsonValue value : DATA.getArray(name)) {
            documents.add(value.asDocument().clone());
        }
        return documents;
    }

    public static List<Oplog> ops(String name) {
        List<Oplog> ops = new ArrayList<>();
        for (BsonDocument document : raw(name)) {
            ops.add(Oplog.fromBson(document));
        }
        return ops;
    }
}
