package com.example.craftscore.service;

import com.example.craftscore.config.ScoringProperties;
import com.example.craftscore.exception.UserNotFoundException;
import com.example.craftscore.model.CraftUser;
import com.example.craftscore.model.LevelProgress;
import com.example.craftscore.model.ScoredProject;
import com.example.craftscore.model.SkillLevel;
import com.example.craftscore.model.SkillLevelCalculation;
import com.example.craftscore.model.SkillLevelUpdate;
import com.example.craftscore.model.SkillProgressionEntry;
import com.example.craftscore.model.UserScoring;
import com.example.craftscore.repository.CraftUserRepository;
import com.example.craftscore.repository.ScoredProjectRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Maintains each user's skill level from the scores of their projects.
 * <p>
 * The average is recency weighted: the i-th most recent project weighs {@code e^(-0.1 i)}.
 * A ledger entry is appended only when the level changes.
 */
@Service
public class UserSkillLevelService {

    private static final Logger log = LoggerFactory.getLogger(UserSkillLevelService.class);

    static final double RECENCY_DECAY = 0.1;
    static final int PROJECTS_FOR_FULL_CONFIDENCE = 10;
    static final double STDDEV_NORMALISER = 50.0;

    private final CraftUserRepository userRepository;
    private final ScoredProjectRepository projectRepository;
    private final ScoringProperties properties;
    private final Clock clock;

    static final int LOCK_STRIPES = 64;

    /** Serialises read-modify-write of one user's ledger inside this process; users share stripes by hash. */
    private final ReentrantLock[] userLocks = new ReentrantLock[LOCK_STRIPES];

    public UserSkillLevelService(CraftUserRepository userRepository,
                                 ScoredProjectRepository projectRepository,
                                 ScoringProperties properties,
                                 Clock clock) {
        this.userRepository = userRepository;
        this.projectRepository = projectRepository;
        this.properties = properties;
        this.clock = clock;
        for (int i = 0; i < userLocks.length; i++) {
            userLocks[i] = new ReentrantLock();
        }
    }

    /**
     * Recomputes the user's level from their scored projects without writing anything.
     *
     * @throws UserNotFoundException if the user does not exist
     */
    public SkillLevelCalculation calculateUserSkillLevel(String userId) {
        return calculate(findUser(userId));
    }

    /**
     * Folds the user's latest project into their stored skill record.
     *
     * @param newProjectId project that triggered the update, recorded in the ledger
     * @throws UserNotFoundException if the user does not exist
     * @throws OptimisticLockingFailureException if concurrent writers kept winning for every attempt
     */
    public SkillLevelUpdate updateUserSkillLevel(String userId, String newProjectId) {
        ReentrantLock lock = lockFor(userId);
        lock.lock();
        try {
            int maxAttempts = properties.skill().maxUpdateAttempts();
            for (int attempt = 1; ; attempt++) {
                try {
                    return applyUpdate(userId, newProjectId);
                } catch (OptimisticLockingFailureException e) {
                    if (attempt >= maxAttempts) {
                        log.error("Skill update for user {} lost {} write races, giving up", userId, attempt);
                        throw e;
                    }
                    log.warn("Skill update for user {} conflicted (attempt {}/{}), retrying",
                            userId, attempt, maxAttempts);
                }
            }
        } finally {
            lock.unlock();
        }
    }

    private SkillLevelUpdate applyUpdate(String userId, String newProjectId) {
        CraftUser user = findUser(userId);
        UserScoring stored = user.scoring();
        SkillLevel oldLevel = stored.calculatedSkillLevel();
        SkillLevelCalculation calculation = calculate(user);
        SkillLevel newLevel = calculation.skillLevel();
        boolean levelChanged = oldLevel != newLevel;

        Instant now = clock.instant();
        List<SkillProgressionEntry> ledger = stored.skillProgression();
        if (levelChanged) {
            List<SkillProgressionEntry> appended = new ArrayList<>(ledger);
            appended.add(new SkillProgressionEntry(newLevel, calculation.averageScore(),
                    strictlyAfterLast(ledger, now), calculation.projectCount(), newProjectId));
            ledger = appended;
        }

        userRepository.save(user.withScoring(new UserScoring(
                calculation.averageScore(), newLevel, calculation.projectCount(), ledger, now)));

        if (levelChanged) {
            log.info("User {} moved from {} to {} (average {})", userId, oldLevel.value(), newLevel.value(),
                    String.format("%.2f", calculation.averageScore()));
        } else {
            log.debug("User {} stays {} (average {})", userId, newLevel.value(), calculation.averageScore());
        }
        return new SkillLevelUpdate(userId, levelChanged, oldLevel, newLevel, calculation.averageScore());
    }

    /**
     * Where the score sits between the current level floor and the next one.
     */
    public LevelProgress calculateProgressToNextLevel(int currentScore, SkillLevel currentLevel) {
        return currentLevel.next()
                .map(next -> {
                    int floor = currentLevel.minScore();
                    int threshold = next.minScore();
                    double progress = (currentScore - floor) * 100.0 / (threshold - floor);
                    int percentage = (int) Math.round(Math.max(0.0, Math.min(100.0, progress)));
                    return new LevelProgress(percentage, Math.max(0, threshold - currentScore), threshold);
                })
                .orElse(LevelProgress.MAXED);
    }

    private SkillLevelCalculation calculate(CraftUser user) {
        List<SkillProgressionEntry> history = user.scoring().skillProgression();
        List<Integer> scores = projectRepository.findByUserIdOrderByCreatedAtDesc(user.id()).stream()
                .map(ScoredProject::individualSkillScore)
                .filter(score -> score > 0)
                .toList();
        if (scores.isEmpty()) {
            return SkillLevelCalculation.empty(history);
        }

        double weightedSum = 0;
        double totalWeight = 0;
        for (int i = 0; i < scores.size(); i++) {
            double weight = Math.exp(-RECENCY_DECAY * i);
            weightedSum += scores.get(i) * weight;
            totalWeight += weight;
        }
        double average = weightedSum / totalWeight;
        SkillLevel level = ScoringFramework.skillLevelFor(ScoringFramework.clamp((int) Math.round(average)));
        return new SkillLevelCalculation(level, average, scores.size(), confidence(scores), history);
    }

    static double confidence(List<Integer> scores) {
        double countFactor = Math.min(1.0, scores.size() / (double) PROJECTS_FOR_FULL_CONFIDENCE);
        double stddev = Math.sqrt(ScoringFramework.populationVariance(scores));
        double consistencyFactor = Math.max(0.0, 1.0 - stddev / STDDEV_NORMALISER);
        return countFactor * 0.6 + consistencyFactor * 0.4;
    }

    private static Instant strictlyAfterLast(List<SkillProgressionEntry> ledger, Instant candidate) {
        if (ledger.isEmpty()) return candidate;
        Instant last = ledger.get(ledger.size() - 1).achievedAt();
        return last != null && !candidate.isAfter(last) ? last.plusMillis(1) : candidate;
    }

    ReentrantLock lockFor(String userId) {
        return userLocks[Math.floorMod(userId.hashCode(), userLocks.length)];
    }

    private CraftUser findUser(String userId) {
        return userRepository.findById(userId).orElseThrow(() -> new UserNotFoundException(userId));
    }
}
