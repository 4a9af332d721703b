package dev.neuronic.tinynet;

/**
 * Weight initialization strategies for parametric layers.
 *
 * <p>The choice of initialization affects how quickly a chain starts to learn. All three
 * strategies draw zero-mean weights; they differ only in scale.
 */
public enum WeightInitStrategy {

    /**
     * LeCun initialization: w = random_gaussian * sqrt(1 / fanIn)
     *
     * <p>Keeps the variance of the pre-activations close to the variance of the inputs, which
     * avoids saturating the softmax at the start of training. Default for linear layers.
     */
    LECUN,

    /**
     * Xavier/Glorot uniform initialization: U(-limit, +limit), limit = sqrt(6 / (fanIn + fanOut))
     *
     * <p>Balances forward and backward variance; a good fit for tanh or sigmoid chains.
     */
    XAVIER,

    /**
     * He initialization: w = random_gaussian * sqrt(2 / fanIn)
     *
     * <p>Compensates for ReLU zeroing half of its inputs. Use when linear layers are
     * interleaved with {@link dev.neuronic.tinynet.layers.ReluLayer}.
     */
    HE
}
