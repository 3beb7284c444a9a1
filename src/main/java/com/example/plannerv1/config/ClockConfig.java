package com.example.plannerv1.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.ZoneId;

@Configuration
public class ClockConfig {

    /**
     * 「今日」を決めるための時計。日付はローカル暦日として扱い、タイムゾーンはここでのみ参照する。
     */
    @Bean
    public Clock plannerClock(@Value("${planner.recurrence.zone:}") String zone) {
        if (zone == null || zone.isBlank()) {
            return Clock.systemDefaultZone();
        }
        return Clock.system(ZoneId.of(zone));
    }
}
