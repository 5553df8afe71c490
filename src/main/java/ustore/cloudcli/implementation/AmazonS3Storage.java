package ustore.cloudcli.implementation;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;

import com.amazonaws.AmazonClientException;
import com.amazonaws.AmazonServiceException;
import com.amazonaws.services.s3.AmazonS3;
import com.amazonaws.services.s3.model.GetObjectRequest;
import com.amazonaws.services.s3.model.ListObjectsV2Request;
import com.amazonaws.services.s3.model.ListObjectsV2Result;
import com.amazonaws.services.s3.model.ObjectMetadata;
import com.amazonaws.services.s3.model.PutObjectRequest;
import com.amazonaws.services.s3.model.S3ObjectSummary;
import com.google.common.collect.AbstractIterator;

import ustore.cloudcli.artifacts.Log;
import ustore.cloudcli.artifacts.SystemParameters;
import ustore.cloudcli.config.EffectiveConfig;
import ustore.cloudcli.data.ByteRange;
import ustore.cloudcli.data.Capabilities;
import ustore.cloudcli.data.Entry;
import ustore.cloudcli.data.EntryKind;
import ustore.cloudcli.data.ObjectSink;
import ustore.cloudcli.data.VirtualPath;
import ustore.cloudcli.implementation.ObjectKeyIterator.ObjectRecord;
import ustore.cloudcli.interfaces.InternalStorageInterface;
import ustore.cloudcli.utils.AmazonS3Utils;

/**
 * Implements a storage backend for S3 and the S3-compatible services (MinIO, OSS, COS).
 * <p><p>
 * Writes are spooled to a local temporary file and uploaded on commit, so an aborted write never creates the object.
 */
public class AmazonS3Storage implements InternalStorageInterface 
{
	/** Represents one request against the service, retried on transient faults. */
	protected interface S3Call<T> { T call(); }
	
	private SystemParameters sysParams = SystemParameters.getInstance();
	private AmazonS3Utils utils = AmazonS3Utils.getInstance();
	private Log log = Log.getInstance();
	
	private final EffectiveConfig config;
	private AmazonS3 s3 = null;
	private String bucketName = null;
	
	public AmazonS3Storage(EffectiveConfig cfg) { config = cfg; }
	
	/** Uses an already built client, mainly for tests against a local endpoint. */
	public AmazonS3Storage(AmazonS3 client, String bucket) { config = null; s3 = client; bucketName = bucket; }

	@Override
	public void connect() 
	{
		if(s3 != null) { return; }
		bucketName = config.getBucket();
		s3 = utils.initialize(config);
	}
	
	@Override
	public Capabilities getCapabilities() { return new Capabilities(true, false, false, false, true); }
	
	protected <T> T attempt(S3Call<T> call)
	{
		int storageOpMaxAttempts = sysParams.storageOpMaxAttempts;
		for(int attempt = 0; ; attempt++)
		{
			boolean lastAttempt = (attempt >= storageOpMaxAttempts - 1);
			try { return call.call(); }
			catch (AmazonClientException ace) 
			{ 
				if(lastAttempt == true || utils.isTransient(ace) == false) { throw ace; }
				log.append("[S3] transient failure, attempt " + (attempt + 1) + " of " + storageOpMaxAttempts, Log.TRACE);
			}
		}
	}

	@Override
	public Entry stat(final VirtualPath path) 
	{
		if(path.isRoot() == true) { return Entry.directory(path); }
		
		if(path.isDirectory() == false)
		{
			ObjectMetadata md = attempt(new S3Call<ObjectMetadata>()
			{
				public ObjectMetadata call()
				{
					try { return s3.getObjectMetadata(bucketName, path.getKey()); }
					catch(AmazonServiceException ase) { if(ase.getStatusCode() == 404) { return null; } throw ase; }
				}
			});
			if(md != null)
			{
				return new Entry(path, EntryKind.FILE, md.getContentLength(), 
						md.getLastModified() == null ? null : md.getLastModified().toInstant(), md.getETag(), md.getContentType());
			}
		}
		
		final String prefix = path.getKey() + "/";
		ListObjectsV2Result res = attempt(new S3Call<ListObjectsV2Result>()
		{
			public ListObjectsV2Result call() 
			{ 
				return s3.listObjectsV2(new ListObjectsV2Request().withBucketName(bucketName).withPrefix(prefix).withMaxKeys(1)); 
			}
		});
		if(res.getKeyCount() > 0) 
		{ 
			S3ObjectSummary first = res.getObjectSummaries().isEmpty() ? null : res.getObjectSummaries().get(0);
			boolean marker = first != null && first.getKey().equals(prefix);
			return Entry.directory(path, marker && first.getLastModified() != null ? first.getLastModified().toInstant() : null);
		}
		return null;
	}

	@Override
	public Iterator<Entry> list(VirtualPath dir, boolean recursive) 
	{
		return new ObjectKeyIterator(new PagedListing(dir.asDirectory().getObjectKey(), recursive), dir, recursive);
	}
	
	/** Pulls listing pages from the service only when the previous page is consumed. */
	protected class PagedListing extends AbstractIterator<ObjectRecord>
	{
		private final ListObjectsV2Request request;
		private final Deque<ObjectRecord> page = new ArrayDeque<ObjectRecord>();
		private boolean more = true;
		
		PagedListing(String prefix, boolean recursive)
		{
			request = new ListObjectsV2Request().withBucketName(bucketName).withPrefix(prefix);
			if(recursive == false) { request.setDelimiter("/"); }
		}
		
		@Override
		protected ObjectRecord computeNext() 
		{
			while(page.isEmpty() == true && more == true) { fetch(); }
			return page.isEmpty() ? endOfData() : page.poll();
		}
		
		private void fetch()
		{
			ListObjectsV2Result res = attempt(new S3Call<ListObjectsV2Result>()
			{
				public ListObjectsV2Result call() { return s3.listObjectsV2(request); }
			});
			
			List<ObjectRecord> records = new ArrayList<ObjectRecord>();
			for(S3ObjectSummary s : res.getObjectSummaries())
			{
				records.add(new ObjectRecord(s.getKey(), s.getSize(), s.getLastModified() == null ? null : s.getLastModified().toInstant(), s.getETag()));
			}
			for(String p : res.getCommonPrefixes()) { records.add(new ObjectRecord(p, 0, null, null)); }
			Collections.sort(records, new Comparator<ObjectRecord>()
			{
				public int compare(ObjectRecord a, ObjectRecord b) { return a.getKey().compareTo(b.getKey()); }
			});
			page.addAll(records);
			
			more = res.isTruncated();
			request.setContinuationToken(res.getNextContinuationToken());
		}
	}

	@Override
	public InputStream openRead(final VirtualPath path, final ByteRange range) 
	{
		return attempt(new S3Call<InputStream>()
		{
			public InputStream call()
			{
				GetObjectRequest getReq = new GetObjectRequest(bucketName, path.getKey());
				if(range != null)
				{
					if(range.isOpenEnded() == true) { getReq = getReq.withRange(range.getOffset()); }
					else if(range.getLength() == 0) { return new ByteArrayInputStream(new byte[0]); }
					else { getReq = getReq.withRange(range.getOffset(), range.getLastIndex()); }
				}
				return s3.getObject(getReq).getObjectContent();
			}
		});
	}

	@Override
	public ObjectSink openWrite(final VirtualPath path) throws IOException
	{
		final Path spool = Files.createTempFile("cloudcli-s3-", ".part");
		final OutputStream out = Files.newOutputStream(spool);
		return new ObjectSink()
		{
			private boolean finished = false;
			
			@Override
			public void write(byte[] b, int off, int len) throws IOException { out.write(b, off, len); }
			
			@Override
			public void close() throws IOException
			{
				if(finished == true) { return; }
				finished = true;
				try
				{
					out.close();
					attempt(new S3Call<Object>()
					{
						public Object call() { return s3.putObject(new PutObjectRequest(bucketName, path.getKey(), spool.toFile())); }
					});
				}
				finally { Files.deleteIfExists(spool); }
			}
			
			@Override
			public void abort()
			{
				if(finished == true) { return; }
				finished = true;
				try { out.close(); Files.deleteIfExists(spool); }
				catch(IOException e) { log.append("[S3] could not remove spool file " + spool + ": " + e.getMessage(), Log.WARNING); }
			}
		};
	}
	
	@Override
	public ObjectSink openAppend(VirtualPath path) 
	{
		throw new UnsupportedOperationException("S3-compatible services have no native append");
	}

	@Override
	public void delete(final VirtualPath path) 
	{
		attempt(new S3Call<Object>()
		{
			public Object call() { s3.deleteObject(bucketName, path.getObjectKey()); return null; }
		});
	}

	@Override
	public void createDirectory(final VirtualPath path, boolean recursive) 
	{
		if(path.isRoot() == true) { return; }
		attempt(new S3Call<Object>()
		{
			public Object call()
			{
				ObjectMetadata md = new ObjectMetadata();
				md.setContentLength(0);
				return s3.putObject(bucketName, path.asDirectory().getObjectKey(), new ByteArrayInputStream(new byte[0]), md);
			}
		});
	}

	@Override
	public void copy(final VirtualPath src, final VirtualPath dst) 
	{
		attempt(new S3Call<Object>()
		{
			public Object call() { return s3.copyObject(bucketName, src.getKey(), bucketName, dst.getKey()); }
		});
	}

	@Override
	public void rename(VirtualPath src, VirtualPath dst) 
	{
		throw new UnsupportedOperationException("S3-compatible services have no native rename");
	}

	@Override
	public void disconnect() 
	{
		if(s3 != null) { s3.shutdown(); }
	}
	
	@Override
	public String getName() { return (config == null ? "s3" : config.getProvider().getName()) + "://" + bucketName; }
}
