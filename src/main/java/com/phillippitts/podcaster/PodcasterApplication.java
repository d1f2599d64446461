package com.phillippitts.podcaster;

import com.phillippitts.podcaster.config.audio.AudioToolsProperties;
import com.phillippitts.podcaster.config.fetch.ContentFetchProperties;
import com.phillippitts.podcaster.config.prompt.ScriptPromptProperties;
import com.phillippitts.podcaster.config.voice.VoiceProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableConfigurationProperties({
        AudioToolsProperties.class,
        ScriptPromptProperties.class,
        ContentFetchProperties.class,
        VoiceProperties.class
})
@EnableScheduling
public class PodcasterApplication {

    public static void main(String[] args) {
        SpringApplication.run(PodcasterApplication.class, args);
    }

}
