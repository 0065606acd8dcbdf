package com.fantasygolf.engine.repository.impl;

import com.fantasygolf.engine.model.RankedGolfer;
import com.fantasygolf.engine.repository.PriceBoardRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Repository;
import redis.clients.jedis.DefaultJedisClientConfig;
import redis.clients.jedis.HostAndPort;
import redis.clients.jedis.Jedis;
import redis.clients.jedis.JedisPool;
import redis.clients.jedis.JedisPoolConfig;
import redis.clients.jedis.Transaction;
import redis.clients.jedis.resps.Tuple;

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Price board kept in a Redis sorted set, one member per golfer scored by price.
 * Best effort: when Redis is unreachable callers fall back to the database.
 */
@Repository
public class JedisPriceBoardRepository implements PriceBoardRepository {
    
    private static final Logger logger = LoggerFactory.getLogger(JedisPriceBoardRepository.class);
    
    static final String PRICE_BOARD_KEY = "fantasy-golf:golfer-prices";
    
    private JedisPool jedisPool;
    private volatile boolean available = false;
    
    @Value("${redis.host:localhost}")
    private String redisHost;
    
    @Value("${redis.port:6379}")
    private int redisPort;
    
    @Value("${redis.password:}")
    private String redisPassword;
    
    @Value("${redis.ssl:false}")
    private boolean redisSsl;
    
    @Value("${redis.timeout:2000}")
    private int timeout;
    
    @PostConstruct
    public void init() {
        try {
            JedisPoolConfig poolConfig = new JedisPoolConfig();
            poolConfig.setMaxTotal(16);
            poolConfig.setMaxIdle(8);
            poolConfig.setMinIdle(1);
            poolConfig.setTestOnBorrow(true);
            
            DefaultJedisClientConfig.Builder clientConfigBuilder = DefaultJedisClientConfig.builder()
                .connectionTimeoutMillis(timeout)
                .socketTimeoutMillis(timeout);
            
            if (redisSsl) {
                clientConfigBuilder.ssl(true);
            }
            
            if (redisPassword != null && !redisPassword.isEmpty()) {
                clientConfigBuilder.password(redisPassword);
            }
            
            jedisPool = new JedisPool(poolConfig, new HostAndPort(redisHost, redisPort), clientConfigBuilder.build());
            
            try (Jedis jedis = jedisPool.getResource()) {
                jedis.ping();
                available = true;
                logger.info("Connected to Redis price board at {}:{}{}", redisHost, redisPort,
                    redisSsl ? " (SSL enabled)" : "");
            }
        } catch (Exception e) {
            logger.warn("Redis price board unavailable at {}:{}, reads will use the database: {}",
                redisHost, redisPort, e.getMessage());
            available = false;
        }
    }
    
    @PreDestroy
    public void destroy() {
        if (jedisPool != null && !jedisPool.isClosed()) {
            jedisPool.close();
        }
    }
    
    @Override
    public boolean isAvailable() {
        if (!available || jedisPool == null) {
            return false;
        }
        
        try (Jedis jedis = jedisPool.getResource()) {
            jedis.ping();
            return true;
        } catch (Exception e) {
            available = false;
            return false;
        }
    }
    
    /**
     * Swaps the whole board in one MULTI/EXEC so readers never see a half-written board.
     */
    @Override
    public void replacePrices(Map<String, Long> pricesByGolferId) {
        if (!isAvailable()) {
            throw new IllegalStateException("Redis is not available");
        }
        
        Map<String, Double> members = new HashMap<>();
        pricesByGolferId.forEach((golferId, price) -> members.put(golferId, price.doubleValue()));
        
        try (Jedis jedis = jedisPool.getResource()) {
            Transaction transaction = jedis.multi();
            transaction.del(PRICE_BOARD_KEY);
            if (!members.isEmpty()) {
                transaction.zadd(PRICE_BOARD_KEY, members);
            }
            transaction.exec();
        } catch (Exception e) {
            throw new IllegalStateException("Failed to replace price board in Redis", e);
        }
    }
    
    @Override
    public List<RankedGolfer> getTopN(int limit) {
        if (limit <= 0 || !isAvailable()) {
            return new ArrayList<>();
        }
        
        try (Jedis jedis = jedisPool.getResource()) {
            List<Tuple> tuples = jedis.zrevrangeWithScores(PRICE_BOARD_KEY, 0, limit - 1);
            return toRankedGolfers(tuples);
        } catch (Exception e) {
            logger.warn("Failed to read price board from Redis: {}", e.getMessage());
            return new ArrayList<>();
        }
    }
    
    // Equal prices share a rank
    static List<RankedGolfer> toRankedGolfers(List<Tuple> tuples) {
        List<RankedGolfer> ranked = new ArrayList<>();
        for (int i = 0; i < tuples.size(); i++) {
            Tuple tuple = tuples.get(i);
            long price = Math.round(tuple.getScore());
            int rank = i > 0 && ranked.get(i - 1).getPrice() == price ? ranked.get(i - 1).getRank() : i + 1;
            ranked.add(RankedGolfer.builder()
                .golferId(tuple.getElement())
                .rank(rank)
                .price(price)
                .build());
        }
        return ranked;
    }
}
