package com.novelforge.provider;

/**
 * 正文生成服务；超时与重试由编排器负责
 */
public interface GenerationProvider {

    String generate(String context, String instruction);
}
