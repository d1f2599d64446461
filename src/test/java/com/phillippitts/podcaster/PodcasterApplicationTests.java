package com.phillippitts.podcaster;

import com.phillippitts.podcaster.service.llm.LlmClient;
import com.phillippitts.podcaster.service.orchestration.GenerationOrchestrator;
import com.phillippitts.podcaster.service.orchestration.PodcastService;
import com.phillippitts.podcaster.service.tts.SpeechSynthesizer;
import com.phillippitts.podcaster.service.tts.TtsProvider;
import com.phillippitts.podcaster.service.voice.VoiceProfile;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

@SpringBootTest
class PodcasterApplicationTests {

    @MockBean
    private LlmClient llmClient;

    @MockBean
    private SpeechSynthesizer speechSynthesizer;

    @Autowired
    private GenerationOrchestrator orchestrator;

    @Autowired
    private PodcastService podcastService;

    @Autowired
    @Qualifier("synthesisExecutor")
    private ThreadPoolTaskExecutor synthesisExecutor;

    @Test
    void contextLoads() {
        assertThat(orchestrator).isNotNull();
        assertThat(synthesisExecutor.getThreadNamePrefix()).isEqualTo("synthesis-");
    }

    @Test
    void voicesAreListedForTheActiveProvider() {
        when(speechSynthesizer.activeProvider()).thenReturn(TtsProvider.AZURE);

        assertThat(podcastService.availableVoices())
                .hasSize(6)
                .extracting(VoiceProfile::voiceHandle)
                .contains("en-US-GuyNeural");
    }
}
