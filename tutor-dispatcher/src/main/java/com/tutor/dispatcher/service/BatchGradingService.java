package com.tutor.dispatcher.service;

import com.tutor.common.dto.Content;
import com.tutor.common.dto.LevelGradingResult;
import com.tutor.common.dto.QualityScore;
import com.tutor.common.dto.SourceSignals;
import com.tutor.common.exception.BatchGradingException;
import com.tutor.common.util.IdGenerator;
import com.tutor.dispatcher.config.DispatcherProperties;
import com.tutor.grading.service.ContentGradingService;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Semaphore;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

/**
 * 批量评级服务：并发评级一批内容，并按质量分档。
 * <p>
 * 核心策略：
 * - 固定线程池 + Semaphore 控制并发数，任务排队等待而非失败
 * - 结果与输入顺序一致，单条失败记为 null 并打日志，不影响其余内容
 * - 带进度日志，方便跟踪大批量任务
 */
@Slf4j
@Service
public class BatchGradingService {

    private final ContentGradingService gradingService;
    private final DispatcherProperties properties;
    private final ExecutorService workerPool;

    public BatchGradingService(ContentGradingService gradingService, DispatcherProperties properties) {
        this.gradingService = gradingService;
        this.properties = properties;
        this.workerPool = Executors.newFixedThreadPool(Math.max(1, properties.getMaxConcurrent()));
    }

    /**
     * 并发评定一批内容的等级。
     *
     * @return 与输入顺序一致的结果列表，失败项为 null
     */
    public List<LevelGradingResult> gradeAll(List<Content> contents) {
        return dispatchAll(contents, gradingService::gradeContentLevel);
    }

    /**
     * 按综合质量分将内容分为四档，每档保持输入顺序；评估失败的内容归入 NEEDS_IMPROVEMENT。
     *
     * @param signalsProvider 为每条内容提供来源可信度与新鲜度
     */
    public Map<QualityTier, List<Content>> categorize(List<Content> contents,
                                                     Function<Content, SourceSignals> signalsProvider) {
        List<QualityScore> scores = dispatchAll(contents,
                content -> gradingService.assessContentQuality(content, signalsProvider.apply(content)));

        Map<QualityTier, List<Content>> categorized = new EnumMap<>(QualityTier.class);
        for (QualityTier tier : QualityTier.values()) {
            categorized.put(tier, new ArrayList<>());
        }
        for (int i = 0; i < contents.size(); i++) {
            QualityScore score = scores.get(i);
            categorized.get(tierOf(score)).add(contents.get(i));
        }

        log.info("质量分档完成: 优秀 {}, 良好 {}, 合格 {}, 待改进 {}",
                categorized.get(QualityTier.EXCELLENT).size(),
                categorized.get(QualityTier.GOOD).size(),
                categorized.get(QualityTier.ACCEPTABLE).size(),
                categorized.get(QualityTier.NEEDS_IMPROVEMENT).size());
        return categorized;
    }

    QualityTier tierOf(QualityScore score) {
        if (score == null) {
            return QualityTier.NEEDS_IMPROVEMENT;
        }
        DispatcherProperties.Tiers tiers = properties.getTiers();
        double overall = score.getOverallScore();
        if (overall >= tiers.getExcellent()) {
            return QualityTier.EXCELLENT;
        }
        if (overall >= tiers.getGood()) {
            return QualityTier.GOOD;
        }
        if (overall >= tiers.getAcceptable()) {
            return QualityTier.ACCEPTABLE;
        }
        return QualityTier.NEEDS_IMPROVEMENT;
    }

    /**
     * 并发执行一批任务，用 Semaphore 控制并发度。
     *
     * @param items      待处理的数据列表
     * @param taskRunner 实际的任务逻辑
     * @return 结果列表（与输入顺序一致，失败的为 null）
     * @throws BatchGradingException 调度线程在等待并发名额时被中断
     */
    <T, R> List<R> dispatchAll(List<T> items, Function<T, R> taskRunner) {
        int totalTasks = items.size();
        if (totalTasks == 0) {
            return List.of();
        }
        String batchId = IdGenerator.withPrefix("batch");
        int concurrency = Math.max(1, Math.min(properties.getMaxConcurrent(), totalTasks));

        log.info("开始批量任务 {}: {} 条内容, 并发度: {}", batchId, totalTasks, concurrency);

        Semaphore semaphore = new Semaphore(concurrency);
        AtomicInteger completed = new AtomicInteger(0);
        AtomicInteger succeeded = new AtomicInteger(0);

        List<CompletableFuture<R>> futures = new ArrayList<>();

        for (int idx = 0; idx < totalTasks; idx++) {
            final T item = items.get(idx);
            final int taskIndex = idx;

            // 在调度线程上获取名额，中断时不再提交后续任务
            try {
                semaphore.acquire();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("批量任务 {} 在第 #{} 条处被中断", batchId, taskIndex);
                throw new BatchGradingException("批量任务 " + batchId + " 调度时被中断", e);
            }

            CompletableFuture<R> future = CompletableFuture.supplyAsync(() -> {
                try {
                    R result = taskRunner.apply(item);
                    succeeded.incrementAndGet();
                    return result;
                } catch (Exception e) {
                    log.warn("批量任务 {} 第 #{} 条失败: {}", batchId, taskIndex, e.getMessage());
                    return null;
                } finally {
                    semaphore.release();
                    int done = completed.incrementAndGet();
                    if (done % 10 == 0 || done == totalTasks) {
                        log.info("评级进度: {}/{} (成功 {})", done, totalTasks, succeeded.get());
                    }
                }
            }, workerPool);

            futures.add(future);
        }

        CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();

        List<R> results = new ArrayList<>();
        for (CompletableFuture<R> future : futures) {
            results.add(future.join());
        }

        log.info("批量任务 {} 完成, 成功: {}/{}", batchId, succeeded.get(), totalTasks);
        return results;
    }

    @PreDestroy
    void shutdown() {
        workerPool.shutdown();
    }
}
