package com.postx.pool.publisher;

import com.postx.pool.entity.Platform;
import com.postx.pool.exception.PublisherUnavailableException;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Component;

@Slf4j
@Component
public class PlatformPublisherRegistry {

    private final Map<Platform, PlatformPublisher> publishers = new EnumMap<>(Platform.class);

    public PlatformPublisherRegistry(ObjectProvider<PlatformPublisher> publisherProvider) {
        List<PlatformPublisher> available = publisherProvider.orderedStream().toList();
        for (PlatformPublisher publisher : available) {
            PlatformPublisher previous = publishers.putIfAbsent(publisher.getPlatform(), publisher);
            if (previous != null) {
                log.warn(
                        "Ignoring duplicate publisher {} for {}, keeping {}",
                        publisher.getClass().getSimpleName(),
                        publisher.getPlatform(),
                        previous.getClass().getSimpleName());
            }
        }
        log.info("Registered platform publishers: {}", publishers.keySet());
    }

    public PlatformPublisher publisherFor(Platform platform) {
        PlatformPublisher publisher = publishers.get(platform);
        if (publisher == null) {
            throw new PublisherUnavailableException(platform);
        }
        return publisher;
    }

    public Set<Platform> registeredPlatforms() {
        return publishers.keySet();
    }
}
