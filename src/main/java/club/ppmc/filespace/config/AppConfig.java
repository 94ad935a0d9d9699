/**
 * AppConfig.java
 *
 * Spring Boot 应用的基础配置类。
 * 定义应用级别的Bean，例如所有时间戳统一来源的 Clock。
 */
package club.ppmc.filespace.config;

import java.time.Clock;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class AppConfig {

    /**
     * 定义一个全局的 Clock Bean。
     * 软删除时间戳、创建/更新时间都从这里取值，测试中可以替换为固定时钟。
     *
     * @return 基于UTC的系统时钟。
     */
    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
