package com.deda.plugin;

import java.io.IOException;
import java.util.List;

/** Pipeline tool started with arguments (publisher, validator, ...). */
public interface ToolPlugin extends Plugin {

    void launch(List<String> args) throws IOException;
}
