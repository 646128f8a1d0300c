package com.wangbin.agent.core.job;

import com.wangbin.agent.common.exception.ConfigurationException;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * 任务表，构造后只读，可无锁共享
 */
public class JobTable {

    private final Map<String, JobDescriptor> jobs;

    private JobTable(Map<String, JobDescriptor> jobs) {
        this.jobs = Collections.unmodifiableMap(new LinkedHashMap<>(jobs));
    }

    public static Builder builder() {
        return new Builder();
    }

    public JobDescriptor get(String name) {
        return jobs.get(name);
    }

    public boolean contains(String name) {
        return jobs.containsKey(name);
    }

    public Set<String> getNames() {
        return jobs.keySet();
    }

    public Collection<JobDescriptor> getJobs() {
        return jobs.values();
    }

    public int size() {
        return jobs.size();
    }

    public boolean isEmpty() {
        return jobs.isEmpty();
    }

    @Override
    public String toString() {
        return "JobTable" + jobs.keySet();
    }

    public static class Builder {

        private final Map<String, JobDescriptor> jobs = new LinkedHashMap<>();

        /**
         * 添加任务，名称重复时报错而不是覆盖
         */
        public Builder add(JobDescriptor job) {
            if (jobs.containsKey(job.getName())) {
                throw ConfigurationException.duplicateJob(job.getSection(), job.getName());
            }
            jobs.put(job.getName(), job);
            return this;
        }

        public JobTable build() {
            return new JobTable(jobs);
        }
    }
}
