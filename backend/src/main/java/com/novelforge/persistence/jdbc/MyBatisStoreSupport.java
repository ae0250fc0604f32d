package com.novelforge.persistence.jdbc;

import com.novelforge.common.exception.StorageException;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.RecoverableDataAccessException;
import org.springframework.dao.TransientDataAccessException;

import java.util.function.Supplier;

/**
 * Mapper 调用的异常转换：DataAccessException → StorageException（区分是否瞬时）
 */
abstract class MyBatisStoreSupport {

    protected <T> T execute(String operation, Supplier<T> action) {
        try {
            return action.get();
        } catch (TransientDataAccessException | RecoverableDataAccessException e) {
            throw new StorageException(operation + " 失败(可重试): " + e.getMessage(), e, true);
        } catch (DataAccessException e) {
            throw new StorageException(operation + " 失败: " + e.getMessage(), e, false);
        }
    }

    protected void run(String operation, Runnable action) {
        execute(operation, () -> {
            action.run();
            return null;
        });
    }
}
