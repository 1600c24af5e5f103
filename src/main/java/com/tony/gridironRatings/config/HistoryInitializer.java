package com.tony.gridironRatings.config;

import com.tony.gridironRatings.service.RatingPipelineService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
@Slf4j
public class HistoryInitializer implements CommandLineRunner {
    private final RatingProperties properties;
    private final RatingPipelineService pipelineService;

    @Override
    public void run(String... args) {
        // On ne recharge que si demandé (désactivé en test)
        if (!properties.getHistory().isLoadOnStartup()) {
            log.info("⏭️ Chargement de l'historique Elo désactivé");
            return;
        }
        log.info("🌱 Restauration des notes Elo depuis {}", properties.getHistory().getDirectory());
        pipelineService.restoreFromDisk();
    }
}
