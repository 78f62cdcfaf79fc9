package net.spookly.exthost.project;

import lombok.Value;
import lombok.experimental.Accessors;

@Value
@Accessors(fluent = true)
public class ServiceLifecycleEventArgs {
    ProjectConfig project;
    ServiceConfig service;
}
