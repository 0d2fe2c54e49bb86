package biz.kryukov.dev.svcwatch;

import biz.kryukov.dev.svcwatch.http.ScriptedTransport;
import biz.kryukov.dev.svcwatch.registry.StaticTargetRegistry;
import biz.kryukov.dev.svcwatch.registry.TargetDefinition;
import biz.kryukov.dev.svcwatch.registry.TargetRegistry;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class RegistrySyncTest {

    @Mock
    private TargetRegistry registry;

    private SvcWatch watch(TargetRegistry... registries) {
        SvcWatch.Builder builder = SvcWatch.builder()
                .transport(new ScriptedTransport(call -> ScriptedTransport.reply(200)));
        for (TargetRegistry r : registries) {
            builder.registry(r);
        }
        return builder.build();
    }

    @Test
    void unavailableRegistryIsNotQueried() {
        lenient().when(registry.name()).thenReturn("offline");
        when(registry.available()).thenReturn(false);
        SvcWatch watch = watch(registry);

        assertEquals(0, watch.sync());
        verify(registry, never()).targets();
    }

    @Test
    void failingRegistryKeepsKnownTargets() {
        when(registry.name()).thenReturn("failing");
        when(registry.available()).thenReturn(true);
        when(registry.targets())
                .thenReturn(List.of(TargetDefinition.of("nas", "https://nas.local")))
                .thenThrow(new IllegalStateException("backend down"));
        SvcWatch watch = watch(registry);

        assertEquals(1, watch.sync());
        assertEquals(0, watch.sync());
        assertTrue(watch.target("nas").isPresent());
    }

    @Test
    void registryTargetsAreNotManual() {
        SvcWatch watch = watch(new StaticTargetRegistry("static", List.of(
                TargetDefinition.of("nas", "https://nas.local"),
                TargetDefinition.of("broken", " "))));

        assertEquals(1, watch.sync());

        Target nas = watch.target("nas").orElseThrow();
        assertFalse(nas.manual());
        assertEquals(1, watch.targets().size());
    }

    @Test
    void syncKeepsProbeState() {
        when(registry.available()).thenReturn(true);
        when(registry.targets()).thenReturn(List.of(TargetDefinition.of("nas", "https://nas.local")));
        SvcWatch watch = watch(registry);

        watch.sync();
        watch.probe("nas");
        watch.sync();

        assertEquals(LivenessStatus.UP, watch.target("nas").orElseThrow().status());
    }
}
