package com.lexgate.core.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Settings bound from the {@code lexgate.*} namespace of {@code application.yml}.
 * Relative paths resolve against the tree being analysed.
 */
@Component
@ConfigurationProperties(prefix = "lexgate")
public class LexgateProperties {

    private String tfDir = "policy/tf";
    /** Schema document on the filesystem; the bundled classpath schema is used when blank. */
    private String schemaFile = "";
    private Scan scan = new Scan();
    private Verify verify = new Verify();
    private Waivers waivers = new Waivers();
    private Bridge bridge = new Bridge();
    private Gate gate = new Gate();

    public String getTfDir() {
        return tfDir;
    }

    public void setTfDir(String tfDir) {
        this.tfDir = tfDir;
    }

    public String getSchemaFile() {
        return schemaFile;
    }

    public void setSchemaFile(String schemaFile) {
        this.schemaFile = schemaFile;
    }

    public Scan getScan() {
        return scan;
    }

    public void setScan(Scan scan) {
        this.scan = scan;
    }

    public Verify getVerify() {
        return verify;
    }

    public void setVerify(Verify verify) {
        this.verify = verify;
    }

    public Waivers getWaivers() {
        return waivers;
    }

    public void setWaivers(Waivers waivers) {
        this.waivers = waivers;
    }

    public Bridge getBridge() {
        return bridge;
    }

    public void setBridge(Bridge bridge) {
        this.bridge = bridge;
    }

    public Gate getGate() {
        return gate;
    }

    public void setGate(Gate gate) {
        this.gate = gate;
    }

    public static class Scan {
        private int parallelism = 4;
        private List<String> ignoreDirs = List.of(
                ".git", ".hg", ".svn", ".idea", ".vscode", ".gradle", ".mvn",
                ".lexgate", "target", "build", "out", "node_modules");

        public int getParallelism() {
            return parallelism;
        }

        public void setParallelism(int parallelism) {
            this.parallelism = parallelism;
        }

        public List<String> getIgnoreDirs() {
            return ignoreDirs;
        }

        public void setIgnoreDirs(List<String> ignoreDirs) {
            this.ignoreDirs = ignoreDirs;
        }
    }

    public static class Verify {
        private Duration timeout = Duration.ofMinutes(10);
        private List<CheckCommand> commands = new ArrayList<>();

        public Duration getTimeout() {
            return timeout;
        }

        public void setTimeout(Duration timeout) {
            this.timeout = timeout;
        }

        public List<CheckCommand> getCommands() {
            return commands;
        }

        public void setCommands(List<CheckCommand> commands) {
            this.commands = commands;
        }
    }

    /** One external check, e.g. {@code mvn -q -o compile}. */
    public static class CheckCommand {
        private String name;
        private List<String> argv = new ArrayList<>();

        public CheckCommand() {}

        public CheckCommand(String name, List<String> argv) {
            this.name = name;
            this.argv = argv;
        }

        public String getName() {
            return name;
        }

        public void setName(String name) {
            this.name = name;
        }

        public List<String> getArgv() {
            return argv;
        }

        public void setArgv(List<String> argv) {
            this.argv = argv;
        }
    }

    public static class Waivers {
        private String dir = ".lexgate/waivers";

        public String getDir() {
            return dir;
        }

        public void setDir(String dir) {
            this.dir = dir;
        }
    }

    public static class Bridge {
        private String tasksDir = ".lexgate/tasks";
        private Duration waiverTtl = Duration.ofDays(14);

        public String getTasksDir() {
            return tasksDir;
        }

        public void setTasksDir(String tasksDir) {
            this.tasksDir = tasksDir;
        }

        public Duration getWaiverTtl() {
            return waiverTtl;
        }

        public void setWaiverTtl(Duration waiverTtl) {
            this.waiverTtl = waiverTtl;
        }
    }

    public static class Gate {
        private List<String> tiers = List.of("L1");
        private List<String> extraTfIds = List.of();

        public List<String> getTiers() {
            return tiers;
        }

        public void setTiers(List<String> tiers) {
            this.tiers = tiers;
        }

        public List<String> getExtraTfIds() {
            return extraTfIds;
        }

        public void setExtraTfIds(List<String> extraTfIds) {
            this.extraTfIds = extraTfIds;
        }
    }
}
