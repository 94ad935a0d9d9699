/**
 * FileSpaceRepository.java
 *
 * FileSpace 的持久化接口。
 * 除常规查询外，还提供对 filespace 行加悲观写锁的方法，用于串行化同一 filespace 内的结构性修改。
 */
package club.ppmc.filespace.repository;

import club.ppmc.filespace.model.FileSpace;
import jakarta.persistence.LockModeType;
import jakarta.persistence.QueryHint;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.jpa.repository.QueryHints;
import org.springframework.data.repository.query.Param;

public interface FileSpaceRepository extends JpaRepository<FileSpace, UUID> {

    boolean existsByOwnerIdAndName(String ownerId, String name);

    boolean existsByOwnerIdAndNameAndIdNot(String ownerId, String name, UUID id);

    Optional<FileSpace> findByOwnerIdAndName(String ownerId, String name);

    List<FileSpace> findByOwnerIdOrderByCreatedAtDesc(String ownerId);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @QueryHints(@QueryHint(name = "jakarta.persistence.lock.timeout", value = "5000"))
    @Query("select f from FileSpace f where f.id = :id")
    Optional<FileSpace> findAndLockById(@Param("id") UUID id);
}
