package com.novelforge.service.context;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 单个项目的工作记忆：最近 N 段原文 + 滚动摘要
 *
 * 读操作拿到的是不可变快照；写操作（追加片段、折叠摘要）通过 appendLock 串行
 */
public class ProjectContext {

    private final String projectId;
    private final int windowSize;
    private final ReentrantLock appendLock = new ReentrantLock();

    private volatile List<String> window = Collections.emptyList();
    private volatile String rollingSummary;
    private volatile long lastAccessMillis = System.currentTimeMillis();

    public ProjectContext(String projectId, int windowSize, String rollingSummary) {
        if (windowSize < 1) {
            throw new IllegalArgumentException("windowSize必须大于0");
        }
        this.projectId = projectId;
        this.windowSize = windowSize;
        this.rollingSummary = rollingSummary;
    }

    public String getProjectId() {
        return projectId;
    }

    public int getWindowSize() {
        return windowSize;
    }

    /**
     * 近期原文，按时间正序
     */
    public List<String> recentSegments() {
        touch();
        return window;
    }

    public String getRollingSummary() {
        touch();
        return rollingSummary;
    }

    void setRollingSummary(String rollingSummary) {
        this.rollingSummary = rollingSummary;
    }

    /**
     * 追加片段，返回被挤出窗口的片段（按时间正序）；调用方需持有 appendLock
     */
    List<String> push(String segment) {
        List<String> next = new ArrayList<>(window);
        next.add(segment);
        List<String> evicted = new ArrayList<>();
        while (next.size() > windowSize) {
            evicted.add(next.remove(0));
        }
        window = Collections.unmodifiableList(next);
        touch();
        return evicted;
    }

    ReentrantLock appendLock() {
        return appendLock;
    }

    void touch() {
        lastAccessMillis = System.currentTimeMillis();
    }

    public long getLastAccessMillis() {
        return lastAccessMillis;
    }
}
