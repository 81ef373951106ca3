package com.linlay.goapengine.spi.support;

import com.linlay.goapengine.core.AgentProcess;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class InMemoryAgentProcessRepositoryTest {

    @Test
    void shouldEvictOldestBeyondWindow() {
        InMemoryAgentProcessRepository repository = new InMemoryAgentProcessRepository(3);
        List<AgentProcess> processes = processes(5);

        processes.forEach(repository::save);

        assertThat(repository.size()).isEqualTo(3);
        assertThat(repository.findById("p0")).isEmpty();
        assertThat(repository.findById("p1")).isEmpty();
        assertThat(repository.findById("p4")).contains(processes.get(4));
    }

    @Test
    void shouldRefreshPositionWhenSavedAgain() {
        InMemoryAgentProcessRepository repository = new InMemoryAgentProcessRepository(2);
        List<AgentProcess> processes = processes(3);

        repository.save(processes.get(0));
        repository.save(processes.get(1));
        repository.save(processes.get(0));
        repository.save(processes.get(2));

        assertThat(repository.findById("p0")).isPresent();
        assertThat(repository.findById("p1")).isEmpty();
    }

    @Test
    void shouldDeleteAndClear() {
        InMemoryAgentProcessRepository repository = new InMemoryAgentProcessRepository();
        List<AgentProcess> processes = processes(2);
        processes.forEach(repository::save);

        repository.delete(processes.get(0));
        assertThat(repository.findById("p0")).isEmpty();
        assertThat(repository.size()).isEqualTo(1);

        repository.clear();
        assertThat(repository.size()).isZero();
        assertThat(repository.findById(null)).isEmpty();
        assertThat(repository.getWindowSize()).isEqualTo(InMemoryAgentProcessRepository.DEFAULT_WINDOW_SIZE);
    }

    @Test
    void shouldRejectNonPositiveWindow() {
        assertThatThrownBy(() -> new InMemoryAgentProcessRepository(0))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("windowSize");
    }

    private static List<AgentProcess> processes(int count) {
        List<AgentProcess> processes = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            AgentProcess process = mock(AgentProcess.class);
            when(process.id()).thenReturn("p" + i);
            processes.add(process);
        }
        return processes;
    }
}
