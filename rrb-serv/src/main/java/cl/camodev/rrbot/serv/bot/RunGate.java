package cl.camodev.rrbot.serv.bot;

import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Latch that can be closed and reopened. The main loop blocks on it while the bot is paused.
 */
public class RunGate {
	private final ReentrantLock lock = new ReentrantLock();
	private final Condition opened = lock.newCondition();
	private boolean open = true;

	public void open() {
		lock.lock();
		try {
			open = true;
			opened.signalAll();
		} finally {
			lock.unlock();
		}
	}

	public void close() {
		lock.lock();
		try {
			open = false;
		} finally {
			lock.unlock();
		}
	}

	public boolean isOpen() {
		lock.lock();
		try {
			return open;
		} finally {
			lock.unlock();
		}
	}

	public void awaitOpen() throws InterruptedException {
		lock.lock();
		try {
			while (!open) {
				opened.await();
			}
		} finally {
			lock.unlock();
		}
	}

	/**
	 * @return true if the gate was open before the timeout elapsed
	 */
	public boolean awaitOpen(long timeout, TimeUnit unit) throws InterruptedException {
		long remaining = unit.toNanos(timeout);
		lock.lock();
		try {
			while (!open) {
				if (remaining <= 0) {
					return false;
				}
				remaining = opened.awaitNanos(remaining);
			}
			return true;
		} finally {
			lock.unlock();
		}
	}
}
