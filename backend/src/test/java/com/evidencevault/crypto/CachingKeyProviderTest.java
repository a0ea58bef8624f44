package com.evidencevault.crypto;

import java.security.SecureRandom;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import com.evidencevault.VaultTestHarness;
import com.evidencevault.error.NotFoundException;

import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class CachingKeyProviderTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2025-01-01T00:00:00Z"), ZoneOffset.UTC);

    @Mock
    private KeyRecordStore mockStore;

    private CachingKeyProvider provider(KeyRecordStore store) {
        return new CachingKeyProvider(store, new SecureRandom(), CLOCK, VaultTestHarness.properties(0.7));
    }

    @Test
    void firstUseIssuesAKeyAndKeepsReturningIt() {
        CachingKeyProvider provider = provider(new InMemoryKeyRecordStore());

        VaultKey first = provider.currentKey().block();
        VaultKey second = provider.currentKey().block();

        assertNotNull(first);
        assertEquals(32, first.material().length);
        assertEquals(first.keyId(), second.keyId());
        assertTrue(first.keyId().startsWith("key-"));
    }

    @Test
    void rotationIssuesNewKeyAndKeepsOldOneResolvable() {
        InMemoryKeyRecordStore store = new InMemoryKeyRecordStore();
        CachingKeyProvider provider = provider(store);
        VaultKey original = provider.currentKey().block();

        VaultKey rotated = provider.rotate().block();

        assertNotEquals(original.keyId(), rotated.keyId());
        StepVerifier.create(provider.currentKey())
                .assertNext(current -> assertEquals(rotated.keyId(), current.keyId()))
                .verifyComplete();

        // a second node with a cold cache still resolves the retired key
        StepVerifier.create(provider(store).keyById(original.keyId()))
                .assertNext(key -> assertArrayEquals(original.material(), key.material()))
                .verifyComplete();
    }

    @Test
    void unknownKeyIdIsNotFound() {
        StepVerifier.create(provider(new InMemoryKeyRecordStore()).keyById("key-missing"))
                .expectError(NotFoundException.class)
                .verify();
    }

    @Test
    void losingTheFirstKeyRaceAdoptsTheWinner() {
        VaultKey winner = new VaultKey("key-winner", new byte[32], CLOCK.instant());
        when(mockStore.currentKeyId()).thenReturn(Mono.empty(), Mono.just("key-winner"));
        when(mockStore.insertIfAbsent(any(VaultKey.class))).thenReturn(Mono.just(true));
        when(mockStore.compareAndSetCurrent(isNull(), anyString())).thenReturn(Mono.just(false));
        when(mockStore.findById("key-winner")).thenReturn(Mono.just(winner));

        StepVerifier.create(provider(mockStore).currentKey())
                .assertNext(key -> assertEquals("key-winner", key.keyId()))
                .verifyComplete();

        verify(mockStore, times(2)).currentKeyId();
    }
}
