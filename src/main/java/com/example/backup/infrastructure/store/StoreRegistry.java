package com.example.backup.infrastructure.store;

import com.example.backup.config.BackupProperties;
import com.example.backup.domain.exception.BusyException;
import com.example.backup.domain.exception.PolicyViolationException;
import com.example.backup.infrastructure.lock.StoreLockService;
import com.example.backup.infrastructure.util.IdGenerator;
import lombok.extern.slf4j.Slf4j;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 라이브 스토어 목록과 일회용 인스턴스(리허설/스테이징) 관리
 */
@Slf4j
public class StoreRegistry {

    private final StoreInstanceFactory factory;
    private final StoreLockService lockService;
    private final Map<String, StoreInstance> liveStores = new LinkedHashMap<>();
    private final Set<String> disposables = ConcurrentHashMap.newKeySet();

    public StoreRegistry(StoreInstanceFactory factory, BackupProperties properties, StoreLockService lockService) {
        this.factory = factory;
        this.lockService = lockService;
        Set<String> names = new TreeSet<>(properties.getStores().keySet());
        names.add(properties.getDefaultStore());
        for (String name : names) {
            liveStores.put(name, factory.create(name));
        }
        log.info("Store registry initialized: stores={}", liveStores.keySet());
    }

    public StoreInstance get(String storeName) {
        StoreInstance store = liveStores.get(storeName);
        if (store == null) {
            throw new PolicyViolationException(PolicyViolationException.INVALID_REQUEST,
                    "Unknown store: " + storeName, Map.of("store", storeName));
        }
        return store;
    }

    public Set<String> storeNames() {
        return Collections.unmodifiableSet(liveStores.keySet());
    }

    public void addSegmentListener(SegmentListener listener) {
        liveStores.values().stream()
                .filter(InMemoryStoreInstance.class::isInstance)
                .map(InMemoryStoreInstance.class::cast)
                .forEach(store -> store.addSegmentListener(listener));
    }

    /**
     * 내장 스토어 쓰기. 외부 스토어는 세그먼트 수집 API 로만 들어온다.
     * 복구가 스토어를 점유 중이면 Busy (백업 중 쓰기는 허용)
     */
    public ProducedSegment commit(String storeName, List<LogMutation> mutations) {
        InMemoryStoreInstance store = embedded(storeName);
        Optional<String> holder = lockService.currentHolder(storeName);
        if (holder.isPresent() && holder.get().startsWith(StoreLockService.RESTORE_HOLDER_PREFIX)) {
            log.warn("Write to {} refused while {} holds the store", storeName, holder.get());
            throw BusyException.storeLocked(storeName, holder.get());
        }
        return store.commit(mutations);
    }

    public void connectConsumer(String storeName, String consumerId) {
        embedded(storeName).connect(consumerId);
    }

    public void disconnectConsumer(String storeName, String consumerId) {
        embedded(storeName).disconnect(consumerId);
    }

    private InMemoryStoreInstance embedded(String storeName) {
        StoreInstance store = get(storeName);
        if (!(store instanceof InMemoryStoreInstance)) {
            throw new PolicyViolationException(PolicyViolationException.INVALID_REQUEST,
                    "Store " + storeName + " does not accept direct writes", Map.of("store", storeName));
        }
        return (InMemoryStoreInstance) store;
    }

    /**
     * 격리된 일회용 인스턴스 생성 (라이브 스토어와 락을 공유하지 않음)
     */
    public StoreInstance createDisposable(String purpose) {
        String name = IdGenerator.generateInstanceName(purpose);
        StoreInstance instance = factory.create(name);
        disposables.add(name);
        log.debug("Disposable instance created: {}", name);
        return instance;
    }

    public void destroy(StoreInstance instance) {
        if (instance == null) {
            return;
        }
        if (disposables.remove(instance.getName())) {
            instance.disconnectConsumers();
            log.debug("Disposable instance destroyed: {}", instance.getName());
        }
    }

    public int activeDisposableCount() {
        return disposables.size();
    }
}
