package org.example.quizbot.controller;

import org.example.quizbot.service.RotationScheduleService;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.LocalDate;
import java.util.List;

@RestController
@RequestMapping("/api/rotation")
public class RotationController {

    private final RotationScheduleService rotationScheduleService;

    public RotationController(RotationScheduleService rotationScheduleService) {
        this.rotationScheduleService = rotationScheduleService;
    }

    @GetMapping("/today")
    public RotationDay today() {
        return describe(rotationScheduleService.today());
    }

    @GetMapping
    public RotationDay forDate(@RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date) {
        return describe(date);
    }

    private RotationDay describe(LocalDate date) {
        return new RotationDay(
                date,
                rotationScheduleService.dayBucket(date),
                rotationScheduleService.getSchedule().zone().getId(),
                rotationScheduleService.planFor(date)
        );
    }

    public record RotationDay(
            LocalDate date,
            int dayBucket,
            String zone,
            List<RotationScheduleService.SlotPlan> slots
    ) {
    }
}
