package com.evidencevault.export;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import com.evidencevault.vault.AccessLogEntry;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

@Component
@ConditionalOnProperty(prefix = "vault.store", name = "type", havingValue = "in-memory")
public class InMemoryExportRequestStore implements ExportRequestStore {

    private final Map<String, ExportRequest> requests = new ConcurrentHashMap<>();
    private final Map<String, List<AccessLogEntry>> accessLog = new ConcurrentHashMap<>();

    @Override
    public Mono<Void> insert(ExportRequest request) {
        return Mono.fromRunnable(() -> requests.putIfAbsent(request.id(), request.withAccessLog(List.of())));
    }

    @Override
    public Mono<ExportRequest> findById(String requestId) {
        return Mono.fromSupplier(() -> requests.get(requestId));
    }

    @Override
    public Flux<ExportRequest> findByVaultId(String vaultId) {
        return Flux.defer(() -> Flux.fromIterable(List.copyOf(requests.values())))
                .filter(request -> vaultId.equals(request.vaultId()));
    }

    @Override
    public Mono<Boolean> compareAndSetStatus(ExportStatus expected, ExportRequest next) {
        return Mono.fromSupplier(() -> {
            AtomicBoolean applied = new AtomicBoolean(false);
            requests.computeIfPresent(next.id(), (id, current) -> {
                if (current.status() != expected) {
                    return current;
                }
                applied.set(true);
                return next.withAccessLog(List.of());
            });
            return applied.get();
        });
    }

    @Override
    public Mono<Void> appendAccessLog(String requestId, AccessLogEntry entry) {
        return Mono.fromRunnable(() ->
                accessLog.computeIfAbsent(requestId, id -> new CopyOnWriteArrayList<>()).add(entry));
    }

    @Override
    public Flux<AccessLogEntry> findAccessLog(String requestId) {
        return Flux.defer(() -> Flux.fromIterable(List.copyOf(accessLog.getOrDefault(requestId, List.of()))));
    }
}
