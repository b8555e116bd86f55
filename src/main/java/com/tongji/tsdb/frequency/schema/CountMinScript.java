package com.tongji.tsdb.frequency.schema;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * 频次表服务端脚本（Redis 内嵌 Lua 5.1）及其共享约定。
 *
 * <p>键：成对的 (排行索引 ZSET, 草图 HASH)，每一对对应一个时间桶。参数：
 * ARGV[1]=命令，ARGV[2..4]=depth/width/capacity，其余为命令参数。</p>
 * - INCR (weight, member)...：草图恒累加；成员已在索引中则精确累加，索引未满则精确写入，
 *   索引已满且草图估计值超过索引末位时替换末位；
 * - RANKED [limit]：合并各桶，按分数降序（同分按成员字典序）返回 (member, score)；
 * - ESTIMATE member...：每个桶返回一组分数，索引内取精确值，否则取草图最小格；
 * - EXPORT：每个桶返回一份 JSON 快照 {"i":[member,score,...],"e":[cell,count,...]}，并删除该桶；
 * - IMPORT payload...：把快照并入目标桶，之后裁剪索引到容量。
 *
 * <p>草图格坐标：对成员做 SHA-1，第 d 行取第 d 段 8 位十六进制对 width 取模，字段名为 "d,w"。
 * 因此 depth 最大为 5。</p>
 */
public final class CountMinScript {

    public static final String INCR = "INCR";
    public static final String RANKED = "RANKED";
    public static final String ESTIMATE = "ESTIMATE";
    public static final String EXPORT = "EXPORT";
    public static final String IMPORT = "IMPORT";

    public static final int MAX_DEPTH = 5;

    private CountMinScript() {}

    /**
     * 计算成员在草图中的 depth 个格字段名（与 Lua 中 cells() 完全一致）。
     */
    public static String[] cells(String member, int depth, int width) {
        String hash = sha1Hex(member);
        String[] cells = new String[depth];
        for (int d = 1; d <= depth; d++) {
            long segment = Long.parseLong(hash.substring((d - 1) * 8, d * 8), 16);
            cells[d - 1] = d + "," + (segment % width);
        }
        return cells;
    }

    private static String sha1Hex(String value) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-1");
            return HexFormat.of().formatHex(digest.digest(value.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException ex) {
            throw new IllegalStateException("SHA-1 not available", ex);
        }
    }

    public static final String LUA = """
            local command = ARGV[1]
            local depth = tonumber(ARGV[2])
            local width = tonumber(ARGV[3])
            local capacity = tonumber(ARGV[4])

            local sketches = {}
            for i = 1, #KEYS, 2 do
              table.insert(sketches, {index = KEYS[i], estimators = KEYS[i + 1]})
            end

            local function cells(member)
              local h = redis.sha1hex(member)
              local result = {}
              for d = 1, depth do
                local w = tonumber(string.sub(h, (d - 1) * 8 + 1, d * 8), 16) % width
                result[d] = d .. ',' .. w
              end
              return result
            end

            local function sketch_estimate(sketch, member)
              local low = nil
              for _, cell in ipairs(cells(member)) do
                local v = tonumber(redis.call('HGET', sketch.estimators, cell) or '0')
                if low == nil or v < low then low = v end
              end
              return low or 0
            end

            local function estimate(sketch, member)
              local score = redis.call('ZSCORE', sketch.index, member)
              if score then return tonumber(score) end
              return sketch_estimate(sketch, member)
            end

            local function increment(sketch, member, weight)
              local low = nil
              for _, cell in ipairs(cells(member)) do
                local v = redis.call('HINCRBY', sketch.estimators, cell, weight)
                if low == nil or v < low then low = v end
              end
              if redis.call('ZSCORE', sketch.index, member) then
                redis.call('ZINCRBY', sketch.index, weight, member)
              elseif redis.call('ZCARD', sketch.index) < capacity then
                redis.call('ZADD', sketch.index, weight, member)
              else
                local tail = redis.call('ZRANGE', sketch.index, 0, 0, 'WITHSCORES')
                if tonumber(tail[2]) < low then
                  redis.call('ZREM', sketch.index, tail[1])
                  redis.call('ZADD', sketch.index, low, member)
                end
              end
            end

            local function trim(sketch)
              local size = redis.call('ZCARD', sketch.index)
              if size > capacity then
                redis.call('ZREMRANGEBYRANK', sketch.index, 0, size - capacity - 1)
              end
            end

            if command == 'INCR' then
              for _, sketch in ipairs(sketches) do
                for i = 5, #ARGV, 2 do
                  increment(sketch, ARGV[i + 1], tonumber(ARGV[i]))
                end
              end
              return {}
            elseif command == 'RANKED' then
              local limit = tonumber(ARGV[5])
              local totals = {}
              local members = {}
              for _, sketch in ipairs(sketches) do
                for _, member in ipairs(redis.call('ZRANGE', sketch.index, 0, -1)) do
                  if totals[member] == nil then
                    totals[member] = 0
                    table.insert(members, member)
                  end
                end
              end
              for _, member in ipairs(members) do
                local total = 0
                for _, sketch in ipairs(sketches) do
                  total = total + estimate(sketch, member)
                end
                totals[member] = total
              end
              table.sort(members, function(a, b)
                if totals[a] == totals[b] then return a < b end
                return totals[a] > totals[b]
              end)
              local result = {}
              for i, member in ipairs(members) do
                if limit and i > limit then break end
                table.insert(result, {member, tostring(totals[member])})
              end
              return result
            elseif command == 'ESTIMATE' then
              local result = {}
              for _, sketch in ipairs(sketches) do
                local scores = {}
                for i = 5, #ARGV do
                  table.insert(scores, tostring(estimate(sketch, ARGV[i])))
                end
                table.insert(result, scores)
              end
              return result
            elseif command == 'EXPORT' then
              local result = {}
              for _, sketch in ipairs(sketches) do
                local index = redis.call('ZRANGE', sketch.index, 0, -1, 'WITHSCORES')
                local estimators = redis.call('HGETALL', sketch.estimators)
                table.insert(result, cjson.encode({i = index, e = estimators}))
                redis.call('DEL', sketch.index, sketch.estimators)
              end
              return result
            elseif command == 'IMPORT' then
              for n, sketch in ipairs(sketches) do
                local payload = cjson.decode(ARGV[4 + n])
                local index = payload['i']
                local estimators = payload['e']
                for j = 1, #estimators, 2 do
                  redis.call('HINCRBY', sketch.estimators, estimators[j], tonumber(estimators[j + 1]))
                end
                local full = redis.call('ZCARD', sketch.index) >= capacity
                for j = 1, #index, 2 do
                  local member = index[j]
                  local score = tonumber(index[j + 1])
                  if redis.call('ZSCORE', sketch.index, member) then
                    redis.call('ZINCRBY', sketch.index, score, member)
                  elseif not full then
                    redis.call('ZADD', sketch.index, score, member)
                  else
                    redis.call('ZADD', sketch.index, sketch_estimate(sketch, member), member)
                  end
                end
                trim(sketch)
              end
              return {}
            end
            return redis.error_reply('unknown command ' .. tostring(command))
            """;
}
