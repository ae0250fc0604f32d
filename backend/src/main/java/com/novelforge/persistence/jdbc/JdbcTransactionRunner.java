package com.novelforge.persistence.jdbc;

import com.novelforge.common.exception.StorageException;
import com.novelforge.persistence.TransactionRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.function.Supplier;

/**
 * 数据库事务：记忆条目与图谱变更在同一个本地事务中提交
 */
@Component
@ConditionalOnProperty(name = "novel.memory.persistence", havingValue = "jdbc", matchIfMissing = true)
public class JdbcTransactionRunner implements TransactionRunner {

    private final TransactionTemplate transactionTemplate;

    public JdbcTransactionRunner(PlatformTransactionManager transactionManager) {
        this.transactionTemplate = new TransactionTemplate(transactionManager);
    }

    @Override
    public <T> T inTransaction(String projectId, Supplier<T> work) {
        try {
            return transactionTemplate.execute(status -> work.get());
        } catch (TransientDataAccessException e) {
            throw new StorageException("事务提交失败(可重试): " + e.getMessage(), e, true);
        } catch (DataAccessException | TransactionException e) {
            throw new StorageException("事务提交失败: " + e.getMessage(), e, false);
        }
    }
}
