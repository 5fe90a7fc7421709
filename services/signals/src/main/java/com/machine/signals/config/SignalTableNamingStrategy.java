package com.machine.signals.config;

import com.machine.signals.model.SignalRecordEntity;
import org.hibernate.boot.model.naming.CamelCaseToUnderscoresNamingStrategy;
import org.hibernate.boot.model.naming.Identifier;
import org.hibernate.engine.jdbc.env.spi.JdbcEnvironment;

/**
 * Maps the signal entity onto the configured table name; everything else
 * follows Spring Boot's default snake_case naming.
 */
public class SignalTableNamingStrategy extends CamelCaseToUnderscoresNamingStrategy {

    private final String tableName;

    public SignalTableNamingStrategy(String tableName) {
        this.tableName = tableName;
    }

    @Override
    public Identifier toPhysicalTableName(Identifier logicalName, JdbcEnvironment jdbcEnvironment) {
        if (logicalName != null && SignalRecordEntity.TABLE.equalsIgnoreCase(logicalName.getText())) {
            return Identifier.toIdentifier(tableName);
        }
        return super.toPhysicalTableName(logicalName, jdbcEnvironment);
    }
}
