package org.janelia.spatialnorm.app;

import java.util.HashMap;
import java.util.Map;

import com.beust.jcommander.DynamicParameter;
import com.beust.jcommander.Parameter;

public class AppArgs {
    @Parameter(names = "-h", description = "Display help", arity = 0, help = true)
    boolean displayUsage = false;
    @DynamicParameter(names = "-D", description = "Dynamic application parameters that could override application properties")
    Map<String, String> appDynamicConfig = new HashMap<>();
}
