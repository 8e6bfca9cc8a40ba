package io.github.vevoly.sandsnake.api.structure;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;

/**
 * 有序索引成员与分数的包装类。
 * 用于解耦具体 Redis 客户端（如 Redisson）的实现依赖。
 *
 * Sorted index member and score wrapper class.
 * Used to decouple the specific Redis client implementation dependencies (e.g., Redisson).
 *
 * @author vevoly
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ScoredMember implements Serializable {

    private String value;
    private double score;

}
