package io.github.yok.flexpipeline.store;

import io.github.yok.flexpipeline.exception.ConfigurationException;
import io.github.yok.flexpipeline.model.EntitySpec;
import java.util.Set;

/**
 * Source of parsed and validated entity definitions.
 *
 * @author Yasuharu.Okawauchi
 */
public interface ConfigStore {

    /**
     * Returns the names of all configured entities.
     *
     * @return entity names in declaration order
     */
    Set<String> getEntityNames();

    /**
     * Returns the validated definition of an entity.
     *
     * @param entity entity name
     * @return entity definition
     * @throws ConfigurationException if the entity is missing or its definition is invalid
     */
    EntitySpec getEntity(String entity);
}
