package io.surfworks.graphforge.graph;

/**
 * Operator domains and execution-provider identifiers.
 */
public final class Domains {

    private Domains() {}

    /** Built-in operator domain. */
    public static final String ONNX = "";

    /** Alias of {@link #ONNX} that some exporters write out explicitly. */
    public static final String ONNX_ALIAS = "ai.onnx";

    /** Extension operators (fused kernels). */
    public static final String MICROSOFT = "com.microsoft";

    public static final String CPU_EXECUTION_PROVIDER = "CPUExecutionProvider";
    public static final String CUDA_EXECUTION_PROVIDER = "CUDAExecutionProvider";

    /**
     * Returns true if two domain strings name the same domain.
     */
    public static boolean matches(String actual, String expected) {
        return normalize(actual).equals(normalize(expected));
    }

    private static String normalize(String domain) {
        if (domain == null || domain.equals(ONNX_ALIAS)) {
            return ONNX;
        }
        return domain;
    }
}
