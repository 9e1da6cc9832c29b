package win.ixuni.cloudreve.core.operation;

/**
 * Base interface of every Cloudreve operation
 * <p>
 * Login, listing, move, share etc. are each a small immutable command object.
 * 泛型参数 R 表示操作的返回类型。
 * <p>
 * A driver only registers handlers for the operations its protocol version can express;
 * the remaining operations fail with {@code OperationNotSupportedException}.
 *
 * @param <R> 操作返回类型
 */
public interface Operation<R> {

    /**
     * Get the operation name (for logging)
     *
     * @return 操作名称，如 "ListFiles", "Move"
     */
    default String getOperationName() {
        String className = getClass().getSimpleName();
        if (className.endsWith("Operation")) {
            return className.substring(0, className.length() - 9);
        }
        return className;
    }
}
