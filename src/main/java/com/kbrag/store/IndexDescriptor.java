package com.kbrag.store;

import com.kbrag.runtime.AppConfig;
import com.kbrag.runtime.ConfigurationException;

public record IndexDescriptor(String name, int dimension, SpaceType spaceType, Precision precision, int m, int efConstruction) {
    public static final int DEFAULT_M = 16;
    public static final int DEFAULT_EF_CONSTRUCTION = 128;

    public IndexDescriptor {
        if (name == null || name.isBlank()) {
            throw new ConfigurationException("index name must not be blank");
        }
        if (dimension <= 0) {
            throw new ConfigurationException("index dimension must be > 0 but was " + dimension);
        }
        if (m <= 0 || efConstruction <= 0) {
            throw new ConfigurationException("index graph parameters must be > 0 (m=" + m + ", efConstruction=" + efConstruction + ")");
        }
        spaceType = spaceType == null ? SpaceType.COSINE : spaceType;
        precision = precision == null ? Precision.INT8D : precision;
    }

    public static IndexDescriptor of(String name, int dimension) {
        return new IndexDescriptor(name, dimension, SpaceType.COSINE, Precision.INT8D, DEFAULT_M, DEFAULT_EF_CONSTRUCTION);
    }

    public static IndexDescriptor fromConfig(AppConfig.StoreConfig store) {
        return new IndexDescriptor(
                store.getIndexName(),
                store.getDimension(),
                SpaceType.parse(store.getSpaceType()),
                Precision.parse(store.getPrecision()),
                store.getM(),
                store.getEfConstruction());
    }

    public IndexDescriptor withName(String otherName) {
        return new IndexDescriptor(otherName, dimension, spaceType, precision, m, efConstruction);
    }
}
