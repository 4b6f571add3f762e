package com.postx.pool.publisher;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

import com.postx.pool.entity.Platform;
import com.postx.pool.exception.PublisherUnavailableException;
import java.util.stream.Stream;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.beans.factory.ObjectProvider;

@ExtendWith(MockitoExtension.class)
class PlatformPublisherRegistryTest {

    @Mock private ObjectProvider<PlatformPublisher> provider;
    @Mock private PlatformPublisher instagram;
    @Mock private PlatformPublisher secondInstagram;

    @Test
    void publisherFor_FirstRegisteredPublisherWins() {
        when(instagram.getPlatform()).thenReturn(Platform.INSTAGRAM);
        when(secondInstagram.getPlatform()).thenReturn(Platform.INSTAGRAM);
        when(provider.orderedStream()).thenReturn(Stream.of(instagram, secondInstagram));

        PlatformPublisherRegistry registry = new PlatformPublisherRegistry(provider);

        assertSame(instagram, registry.publisherFor(Platform.INSTAGRAM));
        assertEquals(1, registry.registeredPlatforms().size());
    }

    @Test
    void publisherFor_MissingPlatform_Throws() {
        when(provider.orderedStream()).thenReturn(Stream.empty());

        PlatformPublisherRegistry registry = new PlatformPublisherRegistry(provider);

        PublisherUnavailableException ex =
                assertThrows(PublisherUnavailableException.class, () -> registry.publisherFor(Platform.TIKTOK));
        assertEquals("PUBLISHER_UNAVAILABLE", ex.getErrorCode());
    }
}
