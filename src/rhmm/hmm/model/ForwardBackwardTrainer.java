package rhmm.hmm.model;

public interface ForwardBackwardTrainer {

	void train(int[] observations, int iterations);
	void train();
	void forward();
	void backward();
	void posterior();
	void em();
	void check();
	double loglik();
}
