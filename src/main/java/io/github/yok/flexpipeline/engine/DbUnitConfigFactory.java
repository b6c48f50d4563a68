package io.github.yok.flexpipeline.engine;

import io.github.yok.flexpipeline.config.DbUnitConfigProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.dbunit.database.DatabaseConfig;
import org.dbunit.dataset.datatype.IDataTypeFactory;
import org.springframework.stereotype.Component;

/**
 * Applies the application-wide settings to DBUnit's {@link DatabaseConfig}.
 *
 * <p>
 * Sessions call {@link #configure(DatabaseConfig, IDataTypeFactory)} once when they wrap their
 * JDBC connection, so every query table they read back shares the same type mapping and fetch
 * size.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class DbUnitConfigFactory {

    private final DbUnitConfigProperties props;

    /**
     * Applies the settings.
     *
     * @param cfg DBUnit configuration to update
     * @param dataTypeFactory engine-specific data type factory
     */
    public void configure(DatabaseConfig cfg, IDataTypeFactory dataTypeFactory) {
        cfg.setProperty(DatabaseConfig.PROPERTY_DATATYPE_FACTORY, dataTypeFactory);
        log.debug("DBUnit: DataTypeFactory set to {}", dataTypeFactory.getClass().getSimpleName());

        // relation names are always quoted
        cfg.setProperty(DatabaseConfig.PROPERTY_ESCAPE_PATTERN, "\"?\"");

        cfg.setProperty(DatabaseConfig.PROPERTY_FETCH_SIZE, props.getFetchSize());
        log.debug("DBUnit: fetch size = {}", props.getFetchSize());
    }

    public int getBatchSize() {
        return props.getBatchSize();
    }
}
