/**
 * CycleDetectedException.java
 *
 * 移动操作会让节点成为自己的后代时抛出。
 */
package club.ppmc.filespace.exception;

public class CycleDetectedException extends FileSpaceException {

    public CycleDetectedException(String message) {
        super(ErrorCode.CYCLE_DETECTED, message);
    }
}
