package com.tutor.grading.validator;

import com.tutor.common.dto.Content;
import com.tutor.common.dto.LevelFamily;
import com.tutor.common.dto.LevelGradingResult;
import com.tutor.grading.grader.LevelGrader;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * 等级适配度校验：给出内容对任意目标等级的 0-1 适配分。
 * <ol>
 *   <li>目标等级不属于内容语言的等级体系：直接返回 0.0，不做评级</li>
 *   <li>目标等级在评级结果中：返回该等级得分</li>
 *   <li>否则按与评定等级的距离衰减；无法比较时返回 0.5</li>
 * </ol>
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class LevelAppropriatenessValidator {

    static final double UNKNOWN_LEVEL_SCORE = 0.5;

    private final LevelGrader levelGrader;

    public double validate(Content content, String targetLevel) {
        Optional<LevelFamily> family = content.getLanguage().getFamily();
        if (family.isPresent() && !family.get().contains(targetLevel)) {
            log.debug("内容 {} ({}) 与目标等级 {} 不属于同一体系", content.getContentId(),
                    content.getLanguage().getCode(), targetLevel);
            return 0.0;
        }

        LevelGradingResult result = levelGrader.grade(content);
        Double score = targetLevel == null ? null : result.getLevelScores().get(targetLevel);
        if (score != null) {
            return score;
        }

        return family.map(f -> f.distanceScore(result.getAssignedLevel(), targetLevel))
                .orElse(UNKNOWN_LEVEL_SCORE);
    }
}
