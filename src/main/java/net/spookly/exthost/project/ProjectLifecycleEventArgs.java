package net.spookly.exthost.project;

import lombok.Value;
import lombok.experimental.Accessors;

@Value
@Accessors(fluent = true)
public class ProjectLifecycleEventArgs {
    ProjectConfig project;
}
