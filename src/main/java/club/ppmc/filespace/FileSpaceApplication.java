/**
 * FileSpaceApplication.java
 *
 * Spring Boot 应用的主入口类。
 * 负责启动智能体虚拟文件系统 (filespace) 后端。
 */
package club.ppmc.filespace;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class FileSpaceApplication {

    public static void main(String[] args) {
        SpringApplication.run(FileSpaceApplication.class, args);
    }
}
