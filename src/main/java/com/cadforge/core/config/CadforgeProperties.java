package com.cadforge.core.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "cadforge")
public class CadforgeProperties {

    private Solver solver = new Solver();
    private Workspace workspace = new Workspace();
    private Locks locks = new Locks();

    public Solver getSolver() {
        return solver;
    }

    public void setSolver(Solver solver) {
        this.solver = solver;
    }

    public Workspace getWorkspace() {
        return workspace;
    }

    public void setWorkspace(Workspace workspace) {
        this.workspace = workspace;
    }

    public Locks getLocks() {
        return locks;
    }

    public void setLocks(Locks locks) {
        this.locks = locks;
    }

    public static class Solver {

        /** Absolute tolerance for lengths, distances and radii. */
        private double defaultTolerance = 0.01;

        /** Absolute tolerance, in radians, for angles and direction checks. */
        private double angularTolerance = 0.01;

        public double getDefaultTolerance() {
            return defaultTolerance;
        }

        public void setDefaultTolerance(double defaultTolerance) {
            this.defaultTolerance = defaultTolerance;
        }

        public double getAngularTolerance() {
            return angularTolerance;
        }

        public void setAngularTolerance(double angularTolerance) {
            this.angularTolerance = angularTolerance;
        }
    }

    public static class Workspace {

        private String rootId = "main";
        private long mergeLockTtlSeconds = 60;

        public String getRootId() {
            return rootId;
        }

        public void setRootId(String rootId) {
            this.rootId = rootId;
        }

        public long getMergeLockTtlSeconds() {
            return mergeLockTtlSeconds;
        }

        public void setMergeLockTtlSeconds(long mergeLockTtlSeconds) {
            this.mergeLockTtlSeconds = mergeLockTtlSeconds;
        }
    }

    public static class Locks {

        /** auto (JDBC when a DataSource exists), jdbc or memory. */
        private String store = "auto";
        private long defaultTtlSeconds = 300;
        private long maxTtlSeconds = 3600;

        public String getStore() {
            return store;
        }

        public void setStore(String store) {
            this.store = store;
        }

        public long getDefaultTtlSeconds() {
            return defaultTtlSeconds;
        }

        public void setDefaultTtlSeconds(long defaultTtlSeconds) {
            this.defaultTtlSeconds = defaultTtlSeconds;
        }

        public long getMaxTtlSeconds() {
            return maxTtlSeconds;
        }

        public void setMaxTtlSeconds(long maxTtlSeconds) {
            this.maxTtlSeconds = maxTtlSeconds;
        }
    }
}
