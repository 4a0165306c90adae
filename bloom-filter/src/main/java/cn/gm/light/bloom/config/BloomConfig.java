package cn.gm.light.bloom.config;

import lombok.Data;

/**
 * @author 明溪
 * @version 1.0
 * @project bloomFilter
 * @description 过滤器配置
 * @date 2025/3/12 16:48:05
 */
@Data
public class BloomConfig {
    // 预期元素数量
    private long expectedElements = 1_000_000L;

    // 目标误判率
    private double falsePositiveRate = 0.01;

    // 显式指定位数组长度，为空则按预期元素数量和误判率计算
    private Long bits;

    // 显式指定 key 数量，为空则按 bits 和预期元素数量计算
    private Integer keyCount;
}
