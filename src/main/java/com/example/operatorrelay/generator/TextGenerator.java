package com.example.operatorrelay.generator;

import com.example.operatorrelay.exception.TextGenerationException;

/**
 * 文本生成服务接口
 */
public interface TextGenerator {

    /**
     * 根据提示词生成文本
     * @param prompt 提示词
     * @return 生成的文本，可能为空字符串
     * @throws TextGenerationException 调用失败
     */
    String complete(String prompt) throws TextGenerationException;
}
