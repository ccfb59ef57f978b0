package org.janelia.spatialnorm.process;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

/**
 * An executable with its arguments and the environment variables it needs in addition to the inherited ones.
 */
public class ExternalCommand {

    private final List<String> args;
    private final Map<String, String> env;

    private ExternalCommand(List<String> args, Map<String, String> env) {
        Preconditions.checkArgument(!args.isEmpty(), "No executable specified");
        this.args = ImmutableList.copyOf(args);
        this.env = ImmutableMap.copyOf(env);
    }

    public static Builder builder(String executable) {
        return new Builder(executable);
    }

    public String getExecutable() {
        return args.get(0);
    }

    public List<String> getArgs() {
        return args;
    }

    public Map<String, String> getEnv() {
        return env;
    }

    public String getCommandLine() {
        return String.join(" ", args);
    }

    @Override
    public String toString() {
        return getCommandLine();
    }

    public static class Builder {
        private final ImmutableList.Builder<String> argsBuilder = ImmutableList.builder();
        private final Map<String, String> env = new LinkedHashMap<>();

        private Builder(String executable) {
            argsBuilder.add(Preconditions.checkNotNull(executable));
        }

        public Builder addArg(String arg) {
            argsBuilder.add(arg);
            return this;
        }

        public Builder addArgs(String... args) {
            argsBuilder.add(args);
            return this;
        }

        public Builder addArgs(List<String> args) {
            argsBuilder.addAll(args);
            return this;
        }

        public Builder setEnv(String name, String value) {
            env.put(name, value);
            return this;
        }

        public ExternalCommand build() {
            return new ExternalCommand(argsBuilder.build(), env);
        }
    }
}
