package eu.virtualparadox.knowledge.rag.embed;

final class VectorMath {

    private VectorMath() {
    }

    /**
     * L2-normalizes {@code vec} in place; zero vectors stay untouched.
     */
    static void normalize(final float[] vec) {
        double norm = 0.0;
        for (final float v : vec) {
            norm += v * v;
        }
        norm = Math.sqrt(norm);
        if (norm > 0.0) {
            for (int i = 0; i < vec.length; i++) {
                vec[i] /= (float) norm;
            }
        }
    }

    static boolean isZero(final float[] vec) {
        for (final float v : vec) {
            if (v != 0f) {
                return false;
            }
        }
        return true;
    }
}
