package cn.gm.light.bloom.core;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * @author 明溪
 * @version 1.0
 * @project bloomFilter
 * @description 过滤器某一时刻的完整状态，供编解码使用
 * @date 2025/3/13 09:40:22
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class BloomFilterState {
    private long m;

    private long n;

    private long[] keys;

    // 位数组，长度 ceil(m/64)
    private long[] words;
}
