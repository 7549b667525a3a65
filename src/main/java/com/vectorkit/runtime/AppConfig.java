package com.vectorkit.runtime;

import java.nio.file.Path;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.vectorkit.index.DistanceMetric;
import com.vectorkit.index.HnswParameters;

@JsonIgnoreProperties(ignoreUnknown = true)
public class AppConfig {
    private IndexConfig index = new IndexConfig();
    private StorageConfig storage = new StorageConfig();

    public IndexConfig getIndex() {
        return index;
    }

    public void setIndex(IndexConfig index) {
        this.index = index == null ? new IndexConfig() : index;
    }

    public StorageConfig getStorage() {
        return storage;
    }

    public void setStorage(StorageConfig storage) {
        this.storage = storage == null ? new StorageConfig() : storage;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class IndexConfig {
        private int maxLevel = HnswParameters.DEFAULT_MAX_LEVEL;
        private int m = HnswParameters.DEFAULT_M;
        private int mMax = HnswParameters.DEFAULT_M_MAX;
        private int efConstruction = HnswParameters.DEFAULT_EF_CONSTRUCTION;
        private int efSearch = HnswParameters.DEFAULT_EF_SEARCH;
        private DistanceMetric metric = DistanceMetric.SQUARED_EUCLIDEAN;
        private Long seed;

        public int getMaxLevel() {
            return maxLevel;
        }

        public void setMaxLevel(int maxLevel) {
            this.maxLevel = maxLevel;
        }

        public int getM() {
            return m;
        }

        public void setM(int m) {
            this.m = m;
        }

        @JsonProperty("mMax")
        public int getMMax() {
            return mMax;
        }

        @JsonProperty("mMax")
        public void setMMax(int mMax) {
            this.mMax = mMax;
        }

        public int getEfConstruction() {
            return efConstruction;
        }

        public void setEfConstruction(int efConstruction) {
            this.efConstruction = efConstruction;
        }

        public int getEfSearch() {
            return efSearch;
        }

        public void setEfSearch(int efSearch) {
            this.efSearch = efSearch;
        }

        public DistanceMetric getMetric() {
            return metric;
        }

        public void setMetric(DistanceMetric metric) {
            this.metric = metric == null ? DistanceMetric.SQUARED_EUCLIDEAN : metric;
        }

        public Long getSeed() {
            return seed;
        }

        public void setSeed(Long seed) {
            this.seed = seed;
        }

        /**
         * @throws com.vectorkit.index.InvalidParameterException if a value is outside its valid range
         */
        public HnswParameters toParameters() {
            return new HnswParameters(maxLevel, m, mMax, efConstruction, efSearch, metric);
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class StorageConfig {
        private String indexPath = ".vectorkit/vector-index.json";
        private String cacheDirectory = ".vectorkit/vector-cache";
        private int batchSize = 100;
        private int memoryCacheLimit = 10000;

        public String getIndexPath() {
            return indexPath;
        }

        public void setIndexPath(String indexPath) {
            this.indexPath = indexPath;
        }

        public String getCacheDirectory() {
            return cacheDirectory;
        }

        public void setCacheDirectory(String cacheDirectory) {
            this.cacheDirectory = cacheDirectory;
        }

        public int getBatchSize() {
            return batchSize;
        }

        public void setBatchSize(int batchSize) {
            this.batchSize = batchSize;
        }

        public int getMemoryCacheLimit() {
            return memoryCacheLimit;
        }

        public void setMemoryCacheLimit(int memoryCacheLimit) {
            this.memoryCacheLimit = memoryCacheLimit;
        }

        public Path indexFile() {
            return Path.of(indexPath);
        }

        public Path cacheDir() {
            return Path.of(cacheDirectory);
        }
    }
}
