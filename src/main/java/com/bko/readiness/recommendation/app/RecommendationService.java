package com.bko.readiness.recommendation.app;

import com.bko.readiness.recommendation.AlternativeWorkout;
import com.bko.readiness.recommendation.IntensityGuidance;
import com.bko.readiness.recommendation.OvertrainingRisk;
import com.bko.readiness.recommendation.RecommendationRequest;
import com.bko.readiness.recommendation.RecommendationResult;
import com.bko.readiness.recommendation.RecommendationUseCase;
import com.bko.readiness.recommendation.TrainingConstraints;
import com.bko.readiness.recommendation.WorkoutRecommendation;
import com.bko.readiness.recommendation.WorkoutStructure;
import com.bko.readiness.recovery.TrainingIntensity;
import com.bko.readiness.recovery.WorkoutSample;
import com.bko.readiness.shared.AppSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Set;

@Service
public class RecommendationService implements RecommendationUseCase {
    private static final Logger logger = LoggerFactory.getLogger(RecommendationService.class);

    private final IntensityMapper intensityMapper;
    private final OvertrainingPrevention overtrainingPrevention;
    private final TypeRecommender typeRecommender;
    private final AlternativesGenerator alternativesGenerator;
    private final RationaleSynthesizer rationaleSynthesizer;
    private final AppSettings appSettings;

    public RecommendationService(IntensityMapper intensityMapper,
                                 OvertrainingPrevention overtrainingPrevention,
                                 TypeRecommender typeRecommender,
                                 AlternativesGenerator alternativesGenerator,
                                 RationaleSynthesizer rationaleSynthesizer,
                                 AppSettings appSettings) {
        this.intensityMapper = intensityMapper;
        this.overtrainingPrevention = overtrainingPrevention;
        this.typeRecommender = typeRecommender;
        this.alternativesGenerator = alternativesGenerator;
        this.rationaleSynthesizer = rationaleSynthesizer;
        this.appSettings = appSettings;
    }

    @Override
    public RecommendationResult recommend(RecommendationRequest request) {
        TrainingConstraints constraints = request.constraints();
        String sport = constraints.sport() == null ? appSettings.defaultSport() : constraints.sport();
        Integer score = request.overallScore();
        List<WorkoutSample> workouts = request.recentWorkouts().stream()
                .filter(workout -> !workout.date().isAfter(request.date()))
                .sorted(Comparator.comparing(WorkoutSample::date))
                .toList();

        TrainingIntensity proposed = intensityMapper.map(request.score(), request.anomalies());
        OvertrainingPrevention.Decision decision = overtrainingPrevention.check(proposed, request.date(), workouts,
                request.recoveryHistory());
        TrainingIntensity intensity = decision.intensity();

        TypeRecommender.TypeSelection selection = typeRecommender.recommend(intensity, sport, request.date(), workouts,
                constraints, score, Set.of());
        String workoutType = selection.primary().workoutType();
        WorkoutStructure structure = selection.primary().structure();
        String rationale = rationaleSynthesizer.synthesize(intensity, workoutType, request.score(), request.anomalies(),
                workouts, request.date(), constraints);

        List<String> warnings = new ArrayList<>();
        if (decision.isDowngraded()) {
            warnings.add(decision.warning());
        }
        warnings.addAll(request.anomalies().warnings());

        WorkoutRecommendation primary = new WorkoutRecommendation(intensity, workoutType,
                structure.totalDurationMinutes(), structure, rationale, warnings);
        List<AlternativeWorkout> alternatives = alternativesGenerator.generate(primary, sport, score, request.date(), constraints);
        IntensityGuidance guidance = intensityMapper.guidanceFor(intensity, score, request.anomalies().severity());
        OvertrainingRisk risk = overtrainingPrevention.assessRisk(request.date(), workouts, request.recoveryHistory());

        logger.info("Recommended {} {} ({} min, {}) for {} with {} alternative(s)", intensity, workoutType,
                structure.totalDurationMinutes(), sport, request.date(), alternatives.size());
        return new RecommendationResult(primary, alternatives, guidance, risk, decision.warning());
    }
}
