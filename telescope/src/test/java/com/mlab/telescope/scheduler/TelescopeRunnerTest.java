package com.mlab.telescope.scheduler;

import com.mlab.telescope.config.TelescopeProperties;
import com.mlab.telescope.model.RunOptions;
import com.mlab.telescope.model.RunSummary;
import com.mlab.telescope.service.SelectorFileParser;
import com.mlab.telescope.service.TelescopeService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.boot.DefaultApplicationArguments;
import org.springframework.boot.logging.LogLevel;
import org.springframework.boot.logging.LoggingSystem;

import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class TelescopeRunnerTest {

    @Mock
    SelectorFileParser selectorFileParser;

    @Mock
    TelescopeService telescopeService;

    @Mock
    LoggingSystem loggingSystem;

    private TelescopeProperties properties;
    private TelescopeRunner runner;

    @BeforeEach
    void setUp() {
        properties = new TelescopeProperties();
        properties.getOutput().setOutputDir("results/");
        properties.getScheduler().setMaxConcurrentJobs(12);
        runner = new TelescopeRunner(selectorFileParser, telescopeService, properties, loggingSystem);
    }

    @Test
    void runsSelectorsWithCommandLineSwitches() {
        when(selectorFileParser.parseAll(anyList())).thenReturn(List.of());
        when(telescopeService.run(anyList(), any())).thenReturn(new RunSummary(0, 0, 0, 0));

        runner.run(new DefaultApplicationArguments("--dryrun", "--savequery", "a.json", "b.json"));

        verify(selectorFileParser).parseAll(List.of(Path.of("a.json"), Path.of("b.json")));
        ArgumentCaptor<RunOptions> options = ArgumentCaptor.forClass(RunOptions.class);
        verify(telescopeService).run(anyList(), options.capture());
        assertThat(options.getValue().isDryRun()).isTrue();
        assertThat(options.getValue().isSaveQuery()).isTrue();
        assertThat(options.getValue().isIgnoreCache()).isFalse();
        assertThat(options.getValue().getOutputDir()).isEqualTo(Path.of("results/"));
        assertThat(options.getValue().getMaxConcurrentJobs()).isEqualTo(12);
        verify(loggingSystem, never()).setLogLevel(anyString(), any());
    }

    @Test
    void verboseRaisesLogLevel() {
        runner.run(new DefaultApplicationArguments("--verbose"));

        verify(loggingSystem).setLogLevel("com.mlab.telescope", LogLevel.DEBUG);
    }

    @Test
    void nothingToDoWithoutSelectorFiles() {
        runner.run(new DefaultApplicationArguments("--ignorecache"));

        verify(telescopeService, never()).run(anyList(), any());
    }
}
