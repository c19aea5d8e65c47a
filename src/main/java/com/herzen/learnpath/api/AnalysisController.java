package com.herzen.learnpath.api;

import com.herzen.learnpath.service.AnalysisModels;
import com.herzen.learnpath.service.LearningAnalysisService;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/analysis")
public class AnalysisController {
    private final LearningAnalysisService analysisService;

    public AnalysisController(LearningAnalysisService analysisService) {
        this.analysisService = analysisService;
    }

    @PostMapping(consumes = {"text/csv", MediaType.TEXT_PLAIN_VALUE})
    public ResponseEntity<AnalysisModels.AnalysisReport> analyze(@RequestBody String csv,
                                                                 @RequestParam(required = false) Integer k,
                                                                 @RequestParam(required = false) Boolean autoK,
                                                                 @RequestParam(required = false) Long seed,
                                                                 @RequestParam(required = false) String timeframe,
                                                                 @RequestParam(required = false) Integer maxRecommendations) {
        return ResponseEntity.ok(analysisService.analyze(csv,
                new AnalysisModels.AnalysisOptions(k, autoK, seed, timeframe, maxRecommendations)));
    }

    @PostMapping(path = "/students/{studentId}", consumes = {"text/csv", MediaType.TEXT_PLAIN_VALUE})
    public ResponseEntity<AnalysisModels.StudentReport> student(@PathVariable String studentId,
                                                                @RequestBody String csv,
                                                                @RequestParam(required = false) Integer k,
                                                                @RequestParam(required = false) Long seed,
                                                                @RequestParam(required = false) Integer maxRecommendations) {
        return analysisService.analyzeStudent(csv, studentId, new AnalysisModels.AnalysisOptions(k, null, seed, null, maxRecommendations))
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.notFound().build());
    }
}
