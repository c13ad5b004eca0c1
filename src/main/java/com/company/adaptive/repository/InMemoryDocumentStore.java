package com.company.adaptive.repository;

import com.company.adaptive.config.AdaptiveRuntimeProperties;
import com.company.adaptive.domain.Document;
import com.company.adaptive.domain.enums.OperationKind;
import com.company.adaptive.dto.request.StoreRequest;
import com.company.adaptive.dto.response.StoreResult;
import com.company.adaptive.exception.InvalidRequestException;
import com.company.adaptive.exception.StoreUnavailableException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Repository;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Document store kept in memory, partitioned by scope and collection.
 *
 * <p>Filtering supports id lists, metadata equality on every {@code where} field and a
 * case-insensitive substring match on content. When a persist directory is configured
 * its presence is the liveness signal: if it disappears the store reports itself
 * unreachable and rejects operations until {@link #reconnect()} recreates it.
 */
@Repository
@Slf4j
public class InMemoryDocumentStore implements DocumentStore {

    private static final int DEFAULT_QUERY_LIMIT = 10;

    private final Path persistDirectory;
    private final Map<String, Map<String, Document>> collections = new ConcurrentHashMap<>();

    public InMemoryDocumentStore(AdaptiveRuntimeProperties properties) {
        String dir = properties.getStore().getPersistDirectory();
        this.persistDirectory = dir == null || dir.isBlank() ? null : Path.of(dir);
        if (persistDirectory != null) {
            reconnect();
        }
    }

    @Override
    public StoreResult execute(String scope, OperationKind kind, String collection, StoreRequest request) {
        if (collection == null || collection.isBlank()) {
            throw new InvalidRequestException("Collection name must not be blank");
        }
        if (!isReachable()) {
            throw new StoreUnavailableException("Persist directory " + persistDirectory + " is not available");
        }
        StoreRequest args = request == null ? new StoreRequest() : request;
        Map<String, Document> docs = collections.computeIfAbsent(scope + "/" + collection,
                k -> new LinkedHashMap<>());

        synchronized (docs) {
            return switch (kind) {
                case QUERY -> query(collection, docs, args);
                case INSERT -> insert(collection, docs, args);
                case UPDATE -> update(collection, docs, args);
                case DELETE -> delete(collection, docs, args);
            };
        }
    }

    @Override
    public boolean isReachable() {
        return persistDirectory == null || Files.isDirectory(persistDirectory);
    }

    @Override
    public void reconnect() {
        if (persistDirectory == null) {
            return;
        }
        try {
            Files.createDirectories(persistDirectory);
            log.info("Document store attached to {}", persistDirectory);
        } catch (IOException e) {
            throw new StoreUnavailableException("Cannot open persist directory " + persistDirectory, e);
        }
    }

    private StoreResult query(String collection, Map<String, Document> docs, StoreRequest args) {
        int limit = args.getLimit() != null ? args.getLimit() : DEFAULT_QUERY_LIMIT;
        List<Document> matches = new ArrayList<>();
        for (Document doc : docs.values()) {
            if (matches.size() >= limit) {
                break;
            }
            if (matches(doc, args)) {
                matches.add(doc.copy());
            }
        }
        return StoreResult.builder()
                .collection(collection)
                .documents(matches)
                .affected(matches.size())
                .build();
    }

    private StoreResult insert(String collection, Map<String, Document> docs, StoreRequest args) {
        List<Document> incoming = requireDocuments(args);
        for (Document doc : incoming) {
            if (docs.containsKey(doc.getId())) {
                throw new InvalidRequestException("Document already exists: " + doc.getId());
            }
        }
        incoming.forEach(doc -> docs.put(doc.getId(), doc.copy()));
        return StoreResult.builder().collection(collection).affected(incoming.size()).build();
    }

    private StoreResult update(String collection, Map<String, Document> docs, StoreRequest args) {
        int updated = 0;
        for (Document change : requireDocuments(args)) {
            Document existing = docs.get(change.getId());
            if (existing == null) {
                continue;
            }
            Map<String, Object> metadata = existing.getMetadata() == null
                    ? new HashMap<>() : new HashMap<>(existing.getMetadata());
            if (change.getMetadata() != null) {
                metadata.putAll(change.getMetadata());
            }
            docs.put(change.getId(), existing.toBuilder()
                    .content(change.getContent() != null ? change.getContent() : existing.getContent())
                    .metadata(metadata)
                    .build());
            updated++;
        }
        return StoreResult.builder().collection(collection).affected(updated).build();
    }

    private StoreResult delete(String collection, Map<String, Document> docs, StoreRequest args) {
        boolean hasIds = args.getIds() != null && !args.getIds().isEmpty();
        boolean hasWhere = args.getWhere() != null && !args.getWhere().isEmpty();
        if (!hasIds && !hasWhere) {
            throw new InvalidRequestException("Delete needs ids or a where filter");
        }
        int before = docs.size();
        docs.values().removeIf(doc -> matches(doc, args));
        return StoreResult.builder().collection(collection).affected(before - docs.size()).build();
    }

    private static boolean matches(Document doc, StoreRequest args) {
        if (args.getIds() != null && !args.getIds().isEmpty() && !args.getIds().contains(doc.getId())) {
            return false;
        }
        if (args.getWhere() != null) {
            Map<String, Object> metadata = doc.getMetadata() == null ? Map.of() : doc.getMetadata();
            for (Map.Entry<String, Object> condition : args.getWhere().entrySet()) {
                if (!Objects.equals(metadata.get(condition.getKey()), condition.getValue())) {
                    return false;
                }
            }
        }
        if (args.getText() != null && !args.getText().isBlank()) {
            String content = doc.getContent() == null ? "" : doc.getContent().toLowerCase(Locale.ROOT);
            return content.contains(args.getText().trim().toLowerCase(Locale.ROOT));
        }
        return true;
    }

    private static List<Document> requireDocuments(StoreRequest args) {
        if (args.getDocuments() == null || args.getDocuments().isEmpty()) {
            throw new InvalidRequestException("At least one document is required");
        }
        for (Document doc : args.getDocuments()) {
            if (doc.getId() == null || doc.getId().isBlank()) {
                throw new InvalidRequestException("Every document needs an id");
            }
        }
        return args.getDocuments();
    }
}
