// src/main/java/org/learningjava/flowc/config/SandboxProperties.java
package org.learningjava.flowc.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.nio.file.Path;

@Component
@ConfigurationProperties(prefix = "flowc.sandbox")
public class SandboxProperties {
    private String compiler = "g++";
    private String std = "c++17";
    private String workDir = Path.of(System.getProperty("java.io.tmpdir"), "flowc").toString();
    private long compileTimeoutMs = 5000;
    private long runTimeoutMs = 5000;
    private int maxOutputChars = 64 * 1024;
    private boolean keepFiles = false;

    public String getCompiler() { return compiler; }
    public void setCompiler(String v) { this.compiler = v; }
    public String getStd() { return std; }
    public void setStd(String v) { this.std = v; }
    public String getWorkDir() { return workDir; }
    public void setWorkDir(String v) { this.workDir = v; }
    public long getCompileTimeoutMs() { return compileTimeoutMs; }
    public void setCompileTimeoutMs(long v) { this.compileTimeoutMs = v; }
    public long getRunTimeoutMs() { return runTimeoutMs; }
    public void setRunTimeoutMs(long v) { this.runTimeoutMs = v; }
    public int getMaxOutputChars() { return maxOutputChars; }
    public void setMaxOutputChars(int v) { this.maxOutputChars = v; }
    public boolean isKeepFiles() { return keepFiles; }
    public void setKeepFiles(boolean v) { this.keepFiles = v; }
}
