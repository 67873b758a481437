package id.go.kemenkeu.djpbn.sakti.wf.core.retry;

@FunctionalInterface
public interface Sleeper {

    Sleeper THREAD = Thread::sleep;

    void sleep(long millis) throws InterruptedException;
}
