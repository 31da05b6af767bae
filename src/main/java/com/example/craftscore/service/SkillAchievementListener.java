package com.example.craftscore.service;

import com.example.craftscore.model.SkillLevelChangedEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Reacts to level changes. Promotions and demotions are logged separately so they can be
 * followed without the full scoring output.
 */
@Component
public class SkillAchievementListener {

    private static final Logger log = LoggerFactory.getLogger(SkillAchievementListener.class);

    @EventListener
    public void onSkillLevelChanged(SkillLevelChangedEvent event) {
        if (event.newLevel().compareTo(event.oldLevel()) > 0) {
            log.info("Skill level up for user {}: {} -> {} (average {})", event.userId(),
                    event.oldLevel().value(), event.newLevel().value(), String.format("%.1f", event.averageScore()));
        } else {
            log.info("Skill level down for user {}: {} -> {} (average {})", event.userId(),
                    event.oldLevel().value(), event.newLevel().value(), String.format("%.1f", event.averageScore()));
        }
    }
}
